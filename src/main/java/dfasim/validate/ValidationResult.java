package dfasim.validate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Verdict on a single URL.
 *
 * @param valid whether the URL was accepted
 * @param stateSequence states visited while checking the URL
 * @param rejectionReason human readable explanation ({@code null} when valid)
 * @param components pieces of the URL ({@code null} when invalid)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
  @JsonProperty("valid") boolean valid,
  @JsonProperty("state_sequence") List<String> stateSequence,
  @JsonProperty("rejection_reason") String rejectionReason,
  @JsonProperty("components") UrlComponents components
) {

  public ValidationResult {
    stateSequence = List.copyOf(stateSequence);
  }

  static ValidationResult accepted(List<String> stateSequence, UrlComponents components) {
    return new ValidationResult(true, stateSequence, null, components);
  }

  static ValidationResult rejected(List<String> stateSequence, String reason) {
    return new ValidationResult(false, stateSequence, reason, null);
  }

  public Optional<UrlComponents> componentsIfValid() {
    return Optional.ofNullable(components);
  }
}
