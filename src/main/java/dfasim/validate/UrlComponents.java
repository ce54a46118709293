package dfasim.validate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pieces of a valid URL. Missing pieces are empty strings.
 *
 * @param scheme {@code http} or {@code https}
 * @param authority host name
 * @param path path, including its leading {@code /}
 * @param query query, including its leading {@code ?}
 * @param fragment fragment, including its leading {@code #}
 */
public record UrlComponents(
  @JsonProperty("scheme") String scheme,
  @JsonProperty("authority") String authority,
  @JsonProperty("path") String path,
  @JsonProperty("query") String query,
  @JsonProperty("fragment") String fragment
) { }
