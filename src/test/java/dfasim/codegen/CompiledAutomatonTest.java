package dfasim.codegen;

import static org.junit.jupiter.api.Assertions.*;

import dfasim.Automaton;
import dfasim.Simulator;
import dfasim.UnknownSymbolException;
import dfasim.grammar.UrlGrammar;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CompiledAutomatonTest {

  private static final List<String> URLS = List.of(
    "",
    "h",
    "http:",
    "http://",
    "https:",
    "http:x.com",
    "ftp://x.com",
    "http://example.com",
    "https://example.com/path?q=1#frag",
    "https://example.com/a/b/c?x=1&y=2",
    "http://exa[mple.com",
    "http://a b",
    "http://example.com/é"
  );

  // Only `a` is defined out of `q0`, nothing out of `q1`
  private static final Automaton PARTIAL = Automaton
    .builder()
    .states(List.of("q0", "q1"))
    .alphabet("ab")
    .transition("q0", 'a', "q1")
    .start("q0")
    .accepting("q1")
    .build();

  /**
   * Interpreter result, with unknown symbols mapped to {@code null}.
   */
  private static Boolean interpreted(Automaton automaton, String input) {
    try {
      return Simulator.run(automaton, input).accepted();
    } catch (UnknownSymbolException error) {
      return null;
    }
  }

  private static Boolean compiled(CompiledAutomaton acceptor, String input) {
    try {
      return acceptor.accepts(input);
    } catch (UnknownSymbolException error) {
      return null;
    }
  }

  @Test
  void agreesWithInterpreterOnUrls() {
    final Automaton grammar = UrlGrammar.build();
    final CompiledAutomaton acceptor = CompiledAutomaton.compile(grammar);
    for (String url : URLS) {
      assertEquals(interpreted(grammar, url), compiled(acceptor, url), url);
    }
  }

  @Test
  void partialAutomaton() {
    final CompiledAutomaton acceptor = CompiledAutomaton.compile(PARTIAL);
    assertFalse(acceptor.accepts(""));
    assertTrue(acceptor.accepts("a"));
    assertFalse(acceptor.accepts("aa"));
    assertFalse(acceptor.accepts("b"));
    assertFalse(acceptor.accepts("ab"));
  }

  @Test
  void unknownSymbolThrows() {
    final CompiledAutomaton acceptor = CompiledAutomaton.compile(PARTIAL);
    final UnknownSymbolException error = assertThrows(
      UnknownSymbolException.class,
      () -> acceptor.accepts("ac")
    );
    assertEquals('c', error.symbol);
    assertEquals(1, error.position);
    assertTrue(error.trace().isEmpty());
  }

  @Test
  void denseAndSparseSwitches() {
    // `number` switches over contiguous digits (tableswitch), `word` over vowels (lookupswitch)
    final var builder = Automaton
      .builder()
      .states(List.of("start", "number", "word"))
      .alphabet("0123456789aeiou")
      .start("start")
      .accept(List.of("number", "word"));
    for (char digit : "0123456789".toCharArray()) {
      builder.transition("start", digit, "number");
      builder.transition("number", digit, "number");
    }
    for (char vowel : "aeiou".toCharArray()) {
      builder.transition("start", vowel, "word");
      builder.transition("word", vowel, "word");
    }
    final Automaton automaton = builder.build();
    final CompiledAutomaton acceptor = CompiledAutomaton.compile(automaton);

    for (String input : List.of("", "0", "0123456789", "12ae", "aeiou", "a1", "uuu9")) {
      assertEquals(interpreted(automaton, input), compiled(acceptor, input), input);
    }
    assertTrue(acceptor.accepts("0123456789"));
    assertTrue(acceptor.accepts("aeiou"));
    assertFalse(acceptor.accepts("12ae"));
  }

  @Test
  void sinkRejectsImmediately() {
    final Automaton automaton = Automaton
      .builder()
      .state("q0")
      .symbol('a')
      .symbol('b')
      .transition("q0", 'a', "q0")
      .transition("q0", 'b', "nowhere")
      .start("q0")
      .accepting("q0")
      .onUndefinedTarget(Automaton.UndefinedTargetPolicy.USE_TRAP_STATE)
      .build();
    final CompiledAutomaton acceptor = CompiledAutomaton.compile(automaton);

    assertTrue(acceptor.accepts("aaa"));
    assertFalse(acceptor.accepts("ab"));
    // Nothing after the sink is read, so this is a rejection rather than an error
    assertFalse(acceptor.accepts("abz"));
  }

  @Test
  void compilationsAreIndependent() {
    final CompiledAutomaton first = CompiledAutomaton.compile(PARTIAL);
    final CompiledAutomaton second = CompiledAutomaton.compile(UrlGrammar.build());
    assertTrue(first.accepts("a"));
    assertFalse(second.accepts("a"));
    assertSame(PARTIAL, first.automaton());
  }
}
