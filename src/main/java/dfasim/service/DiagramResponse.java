package dfasim.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link AutomatonService#diagram}.
 *
 * @param success whether the automaton could be loaded
 * @param message explanation on failure
 * @param dot Graphviz source ({@code null} on failure)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramResponse(
  @JsonProperty("success") boolean success,
  @JsonProperty("message") String message,
  @JsonProperty("dot") String dot
) { }
