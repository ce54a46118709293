package dfasim.validate;

import dfasim.grammar.UrlGrammar;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates URLs with a regular expression instead of an automaton.
 *
 * <p>The state sequence reported here is only an approximation, reconstructed
 * from which URL components are present. It is meant for display next to the
 * results of {@link AutomatonUrlValidator}, not for analysis.
 */
public final class PatternUrlValidator implements UrlValidator {

  // Path characters may not include '?' or '#', query characters may not include '#'
  private static final String PATH_CHARS = "[-a-zA-Z0-9._~:/\\[\\]@!$&'()*+,;=%]";
  private static final String QUERY_CHARS = "[-a-zA-Z0-9._~:/?\\[\\]@!$&'()*+,;=%]";
  private static final String FRAGMENT_CHARS = "[-a-zA-Z0-9._~:/?#\\[\\]@!$&'()*+,;=%]";

  static final Pattern URL_PATTERN = Pattern.compile(
    "^(https?://)"                                          // scheme
      + "([a-zA-Z0-9][-a-zA-Z0-9]*(\\.[-a-zA-Z0-9]+)*\\.?)" // domain
      + "(:\\d+)?"                                          // port
      + "(/" + PATH_CHARS + "*)?"                           // path
      + "(\\?" + QUERY_CHARS + "*)?"                        // query
      + "(#" + FRAGMENT_CHARS + "*)?$",                     // fragment
    Pattern.CASE_INSENSITIVE
  );

  private final SecurityScanner scanner;

  public PatternUrlValidator(SecurityScanner scanner) {
    this.scanner = scanner;
  }

  @Override
  public SecurityScanner scanner() {
    return scanner;
  }

  @Override
  public ValidationResult validate(String url) {
    final Matcher match = URL_PATTERN.matcher(url);
    if (!match.matches()) {
      return ValidationResult.rejected(approximateFailure(url), RejectionReasons.heuristic(url));
    }

    final var components = new UrlComponents(
      match.group(1).substring(0, match.group(1).indexOf(':')),
      match.group(2),
      orEmpty(match.group(5)),
      orEmpty(match.group(6)),
      orEmpty(match.group(7))
    );

    final var sequence = new ArrayList<String>(List.of(UrlGrammar.START, UrlGrammar.SCHEME, UrlGrammar.AUTHORITY));
    if (!components.path().isEmpty()) {
      sequence.add(UrlGrammar.PATH);
    }
    if (!components.query().isEmpty()) {
      sequence.add(UrlGrammar.QUERY);
    }
    if (!components.fragment().isEmpty()) {
      sequence.add(UrlGrammar.FRAGMENT);
    }
    return ValidationResult.accepted(sequence, components);
  }

  // Guess how far a URL got before it stopped looking like one
  private static List<String> approximateFailure(String url) {
    final var sequence = new ArrayList<String>();
    sequence.add(UrlGrammar.START);

    if (url.startsWith("http")) {
      sequence.add(UrlGrammar.SCHEME);

      final int separator = url.indexOf("://");
      if (separator >= 0) {
        final String remaining = url.substring(separator + 3);
        if (!remaining.isEmpty() && !remaining.startsWith("/")) {
          sequence.add(UrlGrammar.AUTHORITY);
          if (remaining.indexOf('/') >= 0) {
            sequence.add(UrlGrammar.PATH);
          }
          if (remaining.indexOf('?') >= 0) {
            sequence.add(UrlGrammar.QUERY);
          }
          if (remaining.indexOf('#') >= 0) {
            sequence.add(UrlGrammar.FRAGMENT);
          }
        }
      }
    }

    sequence.add(UrlGrammar.REJECTED);
    return sequence;
  }

  private static String orEmpty(String group) {
    return group == null ? "" : group;
  }
}
