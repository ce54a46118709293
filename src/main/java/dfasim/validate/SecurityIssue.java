package dfasim.validate;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Kinds of suspicious content looked for in a URL.
 *
 * <p>All but {@link #EXCESSIVE_LENGTH} are substring patterns, matched case
 * insensitively anywhere in the URL.
 */
public enum SecurityIssue {
  @JsonProperty("sql_injection")
  SQL_INJECTION(
    "(\\b(select|insert|update|delete|drop|union|exec|declare|script)\\b)|(--)|(%27)|(')|(\")|(/\\*)|(\\*/)"
  ),
  @JsonProperty("xss")
  XSS(
    "(<script>)|(javascript:)|(\\balert\\s*\\()|(\\beval\\s*\\()|(\\bexec\\s*\\()|(\\bonload\\s*=)|(\\bonerror\\s*=)"
  ),
  @JsonProperty("path_traversal")
  PATH_TRAVERSAL(
    "(\\.\\./)|(\\.\\.\\\\)|(\\.\\.%2f)|(\\.\\.%5c)"
  ),
  @JsonProperty("command_injection")
  COMMAND_INJECTION(
    "(\\|\\s*[\\w\\-]+)|(;\\s*[\\w\\-]+)|(`[^`]*`)"
  ),
  @JsonProperty("suspicious_chars")
  SUSPICIOUS_CHARS(
    "(\\\\x[0-9a-fA-F]{2})|(\\\\u[0-9a-fA-F]{4})|(\\\\[0-7]{3})"
  ),
  @JsonProperty("protocol_violation")
  PROTOCOL_VIOLATION(
    "(http[^:]*(:|%3A)(//|%2F%2F))"
  ),
  @JsonProperty("open_redirect")
  OPEN_REDIRECT(
    "(url=)|(redirect=)|(return=)|(next=)|(to=)|(link=)|(goto=)"
  ),
  @JsonProperty("excessive_length")
  EXCESSIVE_LENGTH(null);

  private final Pattern pattern;

  SecurityIssue(String regex) {
    this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }

  /**
   * Substring pattern for this issue.
   *
   * @return pattern, or nothing for issues not found by pattern matching
   */
  public Optional<Pattern> pattern() {
    return Optional.ofNullable(pattern);
  }

  /**
   * Name used in JSON reports, eg. {@code sql_injection}.
   */
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
