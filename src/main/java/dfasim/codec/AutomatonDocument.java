package dfasim.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a stored automaton.
 *
 * <p>Transitions are normally a list of {@code {from, on, to}} objects.
 * Documents written by older tools instead carry a
 * {@code transition_function} object keyed by {@code "<state>,<symbol>"};
 * exactly one of the two is expected.
 *
 * @param states every state label
 * @param alphabet every symbol, each a one-character string
 * @param transitions transition triples
 * @param legacyTransitions transitions keyed by {@code "<state>,<symbol>"}
 * @param startState initial state
 * @param acceptStates accepting states
 * @param sinkState state which ends runs (optional)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutomatonDocument(
  @JsonProperty("states") List<String> states,
  @JsonProperty("alphabet") List<String> alphabet,
  @JsonProperty("transitions") List<Transition> transitions,
  @JsonProperty("transition_function") Map<String, String> legacyTransitions,
  @JsonProperty("start_state") String startState,
  @JsonProperty("accept_states") List<String> acceptStates,
  @JsonProperty("sink_state") String sinkState
) {

  /**
   * One entry of the transition function.
   *
   * @param from source state
   * @param on symbol read
   * @param to target state
   */
  public record Transition(
    @JsonProperty("from") String from,
    @JsonProperty("on") String on,
    @JsonProperty("to") String to
  ) { }
}
