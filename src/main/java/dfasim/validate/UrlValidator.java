package dfasim.validate;

import java.util.List;
import java.util.Map;

/**
 * URL checking strategy.
 *
 * <p>Implementations are interchangeable from a caller's point of view: they
 * may disagree on the exact state sequence they report, but not on the shape
 * of their answers.
 */
public interface UrlValidator {

  /**
   * Decide whether a URL is valid.
   *
   * <p>Never throws on odd input: characters a strategy cannot handle turn
   * into a rejection.
   *
   * @param url URL to check
   * @return verdict, states visited, and either a reason or the URL components
   */
  ValidationResult validate(String url);

  /**
   * Scanner used by {@link #detectSecurityIssues}.
   */
  SecurityScanner scanner();

  /**
   * Look for suspicious content in a URL, valid or not.
   *
   * @param url URL to scan
   * @return matched substrings for every issue found
   */
  default Map<SecurityIssue, List<String>> detectSecurityIssues(String url) {
    return scanner().scan(url, validate(url).components());
  }
}
