package dfasim.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of {@link AutomatonService#check}.
 *
 * @param success whether every input could be checked
 * @param message explanation on failure
 * @param accepted acceptance of each input, in order ({@code null} on failure)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckResponse(
  @JsonProperty("success") boolean success,
  @JsonProperty("message") String message,
  @JsonProperty("accepted") List<Boolean> accepted
) { }
