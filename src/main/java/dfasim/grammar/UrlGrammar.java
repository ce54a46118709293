package dfasim.grammar;

import dfasim.Automaton;
import java.util.List;

/**
 * Automaton recognizing {@code http}/{@code https} URLs.
 *
 * <p>The transition table is not written out by hand: for every state, every
 * symbol of the alphabet is classified by a rule and sent to exactly one
 * target. The resulting transition function is total, and {@link #REJECTED}
 * is the sink.
 *
 * <pre>
 *   start --h--&gt; scheme --t,p,s--&gt; scheme --:--&gt; scheme_separator --/--&gt; scheme_separator
 *   scheme_separator --(not / or :)--&gt; authority --/--&gt; path --?--&gt; query --#--&gt; fragment
 * </pre>
 *
 * A URL may end in {@code authority}, {@code path}, {@code query} or
 * {@code fragment}. Ending right after {@code http:} or {@code http://} is a
 * rejection.
 */
public final class UrlGrammar {

  public static final String START = "start";
  public static final String SCHEME = "scheme";
  public static final String SCHEME_SEPARATOR = "scheme_separator";
  public static final String AUTHORITY = "authority";
  public static final String PATH = "path";
  public static final String QUERY = "query";
  public static final String FRAGMENT = "fragment";
  public static final String REJECTED = "rejected";

  /**
   * All states, in the order a well formed URL moves through them.
   */
  public static final List<String> STATES = List.of(
    START,
    SCHEME,
    SCHEME_SEPARATOR,
    AUTHORITY,
    PATH,
    QUERY,
    FRAGMENT,
    REJECTED
  );

  public static final List<String> ACCEPTING = List.of(AUTHORITY, PATH, QUERY, FRAGMENT);

  private static final String ALPHANUMERIC =
    "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  // Symbols allowed to stay within a host name
  private static final String HOST_CHARS = ALPHANUMERIC + "-._";

  // Symbols allowed to stay within a path (note: neither `?` nor `#`)
  private static final String PATH_CHARS = ALPHANUMERIC + "-._~:/@!$&'()*+,;=%";

  /**
   * Every symbol the grammar knows about.
   */
  public static final String ALPHABET = ALPHANUMERIC + "-._~:/?#[]@!$&'()*+,;=%";

  private UrlGrammar() {
  }

  /**
   * Build the URL automaton.
   *
   * <p>Every call produces an equal automaton.
   *
   * @return total automaton with {@code rejected} as its sink
   */
  public static Automaton build() {
    final var builder = Automaton
      .builder()
      .states(STATES)
      .alphabet(ALPHABET)
      .start(START)
      .accept(ACCEPTING)
      .sink(REJECTED);

    for (String state : STATES) {
      for (int i = 0; i < ALPHABET.length(); i++) {
        final char symbol = ALPHABET.charAt(i);
        builder.transition(state, symbol, target(state, symbol));
      }
    }

    return builder.build();
  }

  /**
   * Classify a symbol read in some state.
   *
   * @param state state being left
   * @param symbol symbol read
   * @return state being entered
   */
  static String target(String state, char symbol) {
    switch (state) {
      case START:
        return symbol == 'h' ? SCHEME : REJECTED;

      case SCHEME:
        if (symbol == 't' || symbol == 'p' || symbol == 's') {
          return SCHEME;
        } else if (symbol == ':') {
          return SCHEME_SEPARATOR;
        }
        return REJECTED;

      case SCHEME_SEPARATOR:
        if (symbol == '/') {
          return SCHEME_SEPARATOR;
        } else if (symbol == ':') {
          return REJECTED;
        }
        return AUTHORITY;

      case AUTHORITY:
        if (contains(HOST_CHARS, symbol)) {
          return AUTHORITY;
        }
        return sectionStart(symbol, true);

      case PATH:
        if (contains(PATH_CHARS, symbol)) {
          return PATH;
        }
        return sectionStart(symbol, false);

      case QUERY:
        if (contains(PATH_CHARS, symbol) || symbol == '?') {
          return QUERY;
        } else if (symbol == '#') {
          return FRAGMENT;
        }
        return REJECTED;

      case FRAGMENT:
        if (contains(PATH_CHARS, symbol) || symbol == '?' || symbol == '#') {
          return FRAGMENT;
        }
        return REJECTED;

      case REJECTED:
        return REJECTED;

      default:
        throw new IllegalArgumentException("Unknown URL grammar state " + state);
    }
  }

  // Delimiters that open the next URL component
  private static String sectionStart(char symbol, boolean pathAllowed) {
    if (pathAllowed && symbol == '/') {
      return PATH;
    } else if (symbol == '?') {
      return QUERY;
    } else if (symbol == '#') {
      return FRAGMENT;
    }
    return REJECTED;
  }

  private static boolean contains(String symbols, char symbol) {
    return symbols.indexOf(symbol) >= 0;
  }
}
