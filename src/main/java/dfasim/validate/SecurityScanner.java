package dfasim.validate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks for suspicious substrings in URLs.
 *
 * <p>This is pattern matching only: a reported issue is a hint for a human,
 * not a verdict on the URL.
 */
public final class SecurityScanner {

  public static final int DEFAULT_MAX_PATH_LENGTH = 255;
  public static final int DEFAULT_MAX_QUERY_LENGTH = 1024;

  private final int maxPathLength;
  private final int maxQueryLength;

  public SecurityScanner() {
    this(DEFAULT_MAX_PATH_LENGTH, DEFAULT_MAX_QUERY_LENGTH);
  }

  /**
   * @param maxPathLength longest path not reported as {@link SecurityIssue#EXCESSIVE_LENGTH}
   * @param maxQueryLength longest query not reported as {@link SecurityIssue#EXCESSIVE_LENGTH}
   */
  public SecurityScanner(int maxPathLength, int maxQueryLength) {
    this.maxPathLength = maxPathLength;
    this.maxQueryLength = maxQueryLength;
  }

  /**
   * Scan a URL.
   *
   * @param url URL to scan (need not be valid)
   * @param components pieces of the URL, or {@code null} if it is not valid
   * @return matched substrings for every issue found (issues with no match are absent)
   */
  public Map<SecurityIssue, List<String>> scan(String url, UrlComponents components) {
    final Map<SecurityIssue, List<String>> issues = new EnumMap<>(SecurityIssue.class);

    for (SecurityIssue issue : SecurityIssue.values()) {
      issue.pattern().ifPresent(pattern -> {
        final List<String> matches = findAll(pattern, url);
        if (!matches.isEmpty()) {
          issues.put(issue, matches);
        }
      });
    }

    // Length limits only make sense once the URL has been split up
    if (components != null) {
      final var tooLong = new ArrayList<String>();
      if (components.path().length() > maxPathLength) {
        tooLong.add("path");
      }
      if (components.query().length() > maxQueryLength) {
        tooLong.add("query");
      }
      if (!tooLong.isEmpty()) {
        issues.put(SecurityIssue.EXCESSIVE_LENGTH, tooLong);
      }
    }

    return issues;
  }

  private static List<String> findAll(Pattern pattern, String input) {
    final var matches = new ArrayList<String>();
    final Matcher matcher = pattern.matcher(input);
    while (matcher.find()) {
      matches.add(matcher.group());
    }
    return matches;
  }
}
