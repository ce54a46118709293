package dfasim.codegen;

/**
 * Membership test for a compiled automaton.
 *
 * <p>Implementations are generated at runtime by {@link CompiledAutomaton}.
 */
public interface Acceptor {

  /**
   * Run the automaton over the whole input.
   *
   * @param input characters to feed to the automaton
   * @return whether the automaton accepts the input
   * @throws dfasim.UnknownSymbolException if the run reads a character outside of the alphabet
   */
  boolean accepts(CharSequence input);
}
