package dfasim.grammar;

import static org.junit.jupiter.api.Assertions.*;

import dfasim.Automaton;
import dfasim.RunResult;
import dfasim.Simulator;
import dfasim.UnknownSymbolException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

final class UrlGrammarTest {

  private final Automaton grammar = UrlGrammar.build();

  @Test
  void shapeOfGrammar() {
    assertEquals(8, grammar.states().size());
    assertEquals(UrlGrammar.START, grammar.start());
    assertEquals(List.of("authority", "fragment", "path", "query"), List.copyOf(grammar.accept()));
    assertEquals(Optional.of(UrlGrammar.REJECTED), grammar.sink());
    assertEquals(UrlGrammar.ALPHABET.length(), grammar.alphabet().size());
  }

  @Test
  void transitionFunctionIsTotal() {
    assertTrue(grammar.isTotal());
    for (String state : UrlGrammar.STATES) {
      for (char symbol : UrlGrammar.ALPHABET.toCharArray()) {
        assertTrue(grammar.transition(state, symbol).isPresent(), "(" + state + ", " + symbol + ")");
      }
    }
  }

  @Test
  void rejectedIsAbsorbing() {
    for (char symbol : UrlGrammar.ALPHABET.toCharArray()) {
      assertEquals(Optional.of(UrlGrammar.REJECTED), grammar.transition(UrlGrammar.REJECTED, symbol));
    }
  }

  @Test
  void buildIsDeterministic() {
    assertEquals(grammar, UrlGrammar.build());
  }

  @Test
  void fullUrlEndsInFragment() {
    final RunResult<String> result = Simulator.run(grammar, "https://example.com/path?q=1#frag");
    assertTrue(result.accepted());
    assertEquals(UrlGrammar.FRAGMENT, result.finalState());
  }

  @Test
  void schemeWithoutAuthorityIsRejected() {
    final RunResult<String> bare = Simulator.run(grammar, "http://");
    assertFalse(bare.accepted());
    assertEquals(UrlGrammar.SCHEME_SEPARATOR, bare.finalState());
    assertEquals(RunResult.Halt.CONSUMED, bare.halt());

    final RunResult<String> colon = Simulator.run(grammar, "https:");
    assertFalse(colon.accepted());
    assertEquals(UrlGrammar.SCHEME_SEPARATOR, colon.finalState());
  }

  @Test
  void wrongFirstLetterGoesStraightToRejected() {
    final RunResult<String> result = Simulator.run(grammar, "ftp://x.com");
    assertFalse(result.accepted());
    assertEquals(List.of(UrlGrammar.START, UrlGrammar.REJECTED), result.trace());
    assertEquals(RunResult.Halt.SINK, result.halt());
  }

  @Test
  void traceFollowsComponents() {
    final RunResult<String> result = Simulator.run(grammar, "http://a/b?c#d");
    assertEquals(
      List.of(
        "start", "scheme", "scheme", "scheme", "scheme", "scheme_separator",
        "scheme_separator", "scheme_separator", "authority", "path", "path",
        "query", "query", "fragment", "fragment"
      ),
      result.trace()
    );
  }

  @Test
  void ruleSpotChecks() {
    assertEquals(UrlGrammar.SCHEME, UrlGrammar.target(UrlGrammar.START, 'h'));
    assertEquals(UrlGrammar.REJECTED, UrlGrammar.target(UrlGrammar.START, 'H'));
    assertEquals(UrlGrammar.SCHEME, UrlGrammar.target(UrlGrammar.SCHEME, 's'));
    assertEquals(UrlGrammar.REJECTED, UrlGrammar.target(UrlGrammar.SCHEME, 'h'));
    assertEquals(UrlGrammar.REJECTED, UrlGrammar.target(UrlGrammar.SCHEME_SEPARATOR, ':'));
    assertEquals(UrlGrammar.AUTHORITY, UrlGrammar.target(UrlGrammar.SCHEME_SEPARATOR, '['));
    assertEquals(UrlGrammar.REJECTED, UrlGrammar.target(UrlGrammar.AUTHORITY, '@'));
    assertEquals(UrlGrammar.PATH, UrlGrammar.target(UrlGrammar.PATH, '@'));
    assertEquals(UrlGrammar.REJECTED, UrlGrammar.target(UrlGrammar.PATH, '['));
    assertEquals(UrlGrammar.QUERY, UrlGrammar.target(UrlGrammar.QUERY, '?'));
    assertEquals(UrlGrammar.FRAGMENT, UrlGrammar.target(UrlGrammar.QUERY, '#'));
    assertEquals(UrlGrammar.FRAGMENT, UrlGrammar.target(UrlGrammar.FRAGMENT, '#'));
    assertThrows(IllegalArgumentException.class, () -> UrlGrammar.target("nowhere", 'a'));
  }

  @Test
  void characterOutsideAlphabetIsAnError() {
    final UnknownSymbolException error = assertThrows(
      UnknownSymbolException.class,
      () -> Simulator.run(grammar, "http://a b")
    );
    assertEquals(' ', error.symbol);
    assertEquals(8, error.position);
  }
}
