package dfasim.validate;

import dfasim.Automaton;
import dfasim.RunResult;
import dfasim.Simulator;
import dfasim.UnknownSymbolException;
import dfasim.grammar.UrlGrammar;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates URLs by running them through a URL automaton.
 *
 * <p>The automaton is expected to use the state names of {@link UrlGrammar}:
 * URL components are recovered from the trace by collecting the characters
 * that led into each component's state.
 */
public final class AutomatonUrlValidator implements UrlValidator {

  private static final Logger log = LoggerFactory.getLogger(AutomatonUrlValidator.class);

  private final Automaton grammar;
  private final SecurityScanner scanner;

  public AutomatonUrlValidator(Automaton grammar, SecurityScanner scanner) {
    this.grammar = grammar;
    this.scanner = scanner;
  }

  /**
   * Validator backed by a freshly built {@link UrlGrammar}.
   *
   * @param scanner scanner for security issues
   * @return validator
   */
  public static AutomatonUrlValidator forUrlGrammar(SecurityScanner scanner) {
    return new AutomatonUrlValidator(UrlGrammar.build(), scanner);
  }

  @Override
  public SecurityScanner scanner() {
    return scanner;
  }

  @Override
  public ValidationResult validate(String url) {
    final RunResult<String> run;
    try {
      run = Simulator.run(grammar, url);
    } catch (UnknownSymbolException error) {
      log.debug("Rejecting URL with unknown character at {}", error.position);
      final List<String> trace = error
        .trace()
        .stream()
        .map(Object::toString)
        .collect(Collectors.toCollection(ArrayList::new));
      trace.add(grammar.sink().orElse(UrlGrammar.REJECTED));
      return ValidationResult.rejected(trace, RejectionReasons.unknownSymbol(error.symbol, error.position));
    }

    if (!run.accepted()) {
      return ValidationResult.rejected(run.trace(), RejectionReasons.fromTrace(url, run.trace()));
    }
    return ValidationResult.accepted(run.trace(), components(url, run.trace()));
  }

  /**
   * Split an accepted URL according to the state each character led into.
   *
   * @param url accepted URL
   * @param trace trace of the accepting run (one state longer than the URL)
   * @return URL components
   */
  static UrlComponents components(String url, List<String> trace) {
    final var scheme = new StringBuilder();
    final var authority = new StringBuilder();
    final var path = new StringBuilder();
    final var query = new StringBuilder();
    final var fragment = new StringBuilder();

    for (int i = 0; i < url.length(); i++) {
      final char c = url.charAt(i);
      switch (trace.get(i + 1)) {
        case UrlGrammar.SCHEME:
          scheme.append(c);
          break;
        case UrlGrammar.AUTHORITY:
          authority.append(c);
          break;
        case UrlGrammar.PATH:
          path.append(c);
          break;
        case UrlGrammar.QUERY:
          query.append(c);
          break;
        case UrlGrammar.FRAGMENT:
          fragment.append(c);
          break;
        default:
          break;
      }
    }

    return new UrlComponents(
      scheme.toString(),
      authority.toString(),
      path.toString(),
      query.toString(),
      fragment.toString()
    );
  }
}
