package dfasim.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of {@link AutomatonService#test}.
 *
 * <p>An input symbol outside of the alphabet is a rejection, not a failure:
 * {@code success} stays {@code true} and {@code message} says which symbol
 * stopped the run.
 *
 * @param success whether the automaton could be loaded and run
 * @param accepted whether the input was accepted ({@code null} on failure)
 * @param stateSequence states visited ({@code null} on failure)
 * @param message explanation, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResponse(
  @JsonProperty("success") boolean success,
  @JsonProperty("accepted") Boolean accepted,
  @JsonProperty("state_sequence") List<String> stateSequence,
  @JsonProperty("message") String message
) {

  static TestResponse ran(boolean accepted, List<String> stateSequence, String message) {
    return new TestResponse(true, accepted, List.copyOf(stateSequence), message);
  }

  static TestResponse failed(String message) {
    return new TestResponse(false, null, null, message);
  }
}
