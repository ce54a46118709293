package dfasim.validate;

import dfasim.grammar.UrlGrammar;
import java.util.List;

/**
 * Human readable explanations for rejected URLs.
 */
final class RejectionReasons {

  static final String EMPTY = "URL cannot be empty";
  static final String BAD_SCHEME_START = "URL must start with 'http' or 'https'";
  static final String BAD_SCHEME = "Invalid URL scheme (expected 'http://' or 'https://')";
  static final String MISSING_DOMAIN = "Missing domain after scheme";
  static final String BAD_DOMAIN = "Invalid domain name";
  static final String BAD_FORMAT =
    "URL format is invalid. Please ensure it follows the pattern: http(s)://domain.com/path?query#fragment";

  private RejectionReasons() {
  }

  /**
   * Explain a rejection from the states a URL automaton went through.
   *
   * @param url rejected URL
   * @param trace states visited, ending either in the sink or where the input ran out
   * @return explanation
   */
  static String fromTrace(String url, List<String> trace) {
    if (url.isEmpty()) {
      return EMPTY;
    }

    final String last = trace.get(trace.size() - 1);
    if (!last.equals(UrlGrammar.REJECTED)) {
      switch (last) {
        case UrlGrammar.SCHEME:
          return BAD_SCHEME;
        case UrlGrammar.SCHEME_SEPARATOR:
          return MISSING_DOMAIN;
        default:
          return BAD_FORMAT;
      }
    }

    // The character which led into the sink
    final int offset = trace.size() - 2;
    final char offending = url.charAt(offset);
    final String previous = trace.get(trace.size() - 2);
    switch (previous) {
      case UrlGrammar.START:
        return BAD_SCHEME_START;
      case UrlGrammar.SCHEME:
        return BAD_SCHEME;
      case UrlGrammar.SCHEME_SEPARATOR:
        return BAD_DOMAIN;
      case UrlGrammar.AUTHORITY:
        return BAD_DOMAIN + ": unexpected '" + offending + "' at position " + offset;
      default:
        return "Unexpected '" + offending + "' in " + previous + " at position " + offset;
    }
  }

  /**
   * Explain a rejection by looking at the URL text alone.
   *
   * @param url rejected URL
   * @return explanation
   */
  static String heuristic(String url) {
    if (url.isEmpty()) {
      return EMPTY;
    }
    if (!url.startsWith("http")) {
      return BAD_SCHEME_START;
    }
    if (!url.startsWith("http://") && !url.startsWith("https://")) {
      return BAD_SCHEME;
    }

    final String rest = url.substring(url.indexOf("://") + 3);
    if (rest.isEmpty()) {
      return MISSING_DOMAIN;
    }

    final int slash = rest.indexOf('/');
    final String domain = slash < 0 ? rest : rest.substring(0, slash);
    if (domain.isEmpty() || domain.startsWith(".")) {
      return BAD_DOMAIN;
    }

    return BAD_FORMAT;
  }

  /**
   * Explain a rejection caused by a character no URL may contain.
   *
   * @param symbol offending character
   * @param position offset of the character
   * @return explanation
   */
  static String unknownSymbol(Object symbol, int position) {
    return "Character '" + symbol + "' at position " + position + " is not allowed in a URL";
  }
}
