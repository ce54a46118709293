package dfasim.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link AutomatonService#create}.
 *
 * @param success whether the automaton was built and stored
 * @param message human readable outcome
 * @param dfaId identifier of the stored automaton ({@code null} on failure)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateResponse(
  @JsonProperty("success") boolean success,
  @JsonProperty("message") String message,
  @JsonProperty("dfa_id") String dfaId
) {

  static CreateResponse created(String dfaId) {
    return new CreateResponse(true, "DFA created successfully", dfaId);
  }

  static CreateResponse failed(String message) {
    return new CreateResponse(false, message, null);
  }
}
