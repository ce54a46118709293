package dfasim.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Request to build and store a new automaton.
 *
 * <p>Symbols arrive as strings since that is how JSON clients send them, but
 * each must be exactly one character long.
 *
 * @param states state names
 * @param alphabet input symbols
 * @param transitions transition rows (incomplete rows are skipped)
 * @param startState initial state
 * @param acceptStates accepting states
 */
public record CreateRequest(
  @JsonProperty("states") List<String> states,
  @JsonProperty("alphabet") List<String> alphabet,
  @JsonProperty("transitions") List<TransitionRow> transitions,
  @JsonProperty("start_state") String startState,
  @JsonProperty("accept_states") List<String> acceptStates
) {

  public CreateRequest {
    states = states == null ? List.of() : List.copyOf(states);
    alphabet = alphabet == null ? List.of() : List.copyOf(alphabet);
    transitions = transitions == null ? List.of() : List.copyOf(transitions);
    acceptStates = acceptStates == null ? List.of() : List.copyOf(acceptStates);
  }

  /**
   * One row of the transition table.
   *
   * @param state source state
   * @param symbol symbol read
   * @param nextState target state
   */
  public record TransitionRow(
    @JsonProperty("state") String state,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("next_state") String nextState
  ) {

    boolean isComplete() {
      return !isBlank(state) && !isBlank(symbol) && !isBlank(nextState);
    }

    private static boolean isBlank(String str) {
      return str == null || str.isEmpty();
    }
  }
}
