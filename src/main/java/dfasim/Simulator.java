package dfasim;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interpreter for deterministic finite automata.
 *
 * <p>Runs never mutate the automaton, so the same automaton can be simulated
 * from several threads at once.
 */
public final class Simulator {

  private static final Logger log = LoggerFactory.getLogger(Simulator.class);

  private Simulator() {
  }

  /**
   * Run a DFA either to completion, to a stuck state, or into its sink.
   *
   * @param dfa deterministic finite automata to run
   * @param input symbols to feed to the automaton
   * @return acceptance and the states visited
   * @throws UnknownSymbolException if the input contains a symbol outside of the alphabet
   */
  public static <Q, E> RunResult<Q> run(Dfa<Q, E> dfa, Iterator<E> input) {
    Q currentState = dfa.initial();
    final List<Q> trace = new ArrayList<>();
    trace.add(currentState);

    final Set<E> alphabet = dfa.alphabet();
    final Optional<Q> sink = dfa.sink();
    int position = 0;

    while (input.hasNext()) {
      if (sink.isPresent() && sink.get().equals(currentState)) {
        return new RunResult<>(false, trace, RunResult.Halt.SINK);
      }

      final E symbol = input.next();
      if (!alphabet.contains(symbol)) {
        throw new UnknownSymbolException(symbol, position, trace);
      }

      final Map<E, Q> transitions = dfa.transitionsMap(currentState);
      final Q target = transitions.get(symbol);

      // No transition found
      if (target == null) {
        log.debug("No transition from {} on {} at offset {}", currentState, symbol, position);
        return new RunResult<>(false, trace, RunResult.Halt.NO_TRANSITION);
      }

      currentState = target;
      trace.add(currentState);
      position++;
    }

    if (sink.isPresent() && sink.get().equals(currentState)) {
      return new RunResult<>(false, trace, RunResult.Halt.SINK);
    }
    return new RunResult<>(dfa.accepting().contains(currentState), trace, RunResult.Halt.CONSUMED);
  }

  /**
   * Run an automaton over every character of the input.
   *
   * @param automaton automaton to run
   * @param input characters to feed to the automaton
   * @return acceptance and the states visited
   * @throws UnknownSymbolException if the input contains a character outside of the alphabet
   */
  public static RunResult<String> run(Automaton automaton, CharSequence input) {
    final Iterator<Character> symbols = input
      .chars()
      .mapToObj(c -> Character.valueOf((char) c))
      .iterator();
    final RunResult<String> result = run(automaton, symbols);
    log.debug("Ran {} characters: accepted={}, halt={}", input.length(), result.accepted(), result.halt());
    return result;
  }
}
