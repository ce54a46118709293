package dfasim;

import java.util.*;

/**
 * Deterministic finite automata
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public interface Dfa<Q, E> {

  /**
   * Initial state
   *
   * @return starting state in the machine
   */
  Q initial();

  /**
   * Accepting states
   *
   * @return accepting states in the machine
   */
  Set<Q> accepting();

  /**
   * Input alphabet
   *
   * <p>Symbols outside of this set are not merely unmatched: feeding one to
   * the machine is an error.
   *
   * @return every symbol the machine understands
   */
  Set<E> alphabet();

  /**
   * Non-accepting state which, once entered, ends the run
   *
   * <p>Nothing after the symbol that led into the sink is read, so symbols
   * outside of the {@link #alphabet} at later positions are not reported
   * either. This includes the trap state added by
   * {@link Automaton.UndefinedTargetPolicy#USE_TRAP_STATE}: a run that falls
   * into it rejects instead of failing on a later unknown symbol.
   *
   * @return sink state, if the machine has one
   */
  Optional<Q> sink();

  /**
   * Look up the mapping of transitions from a certain state
   *
   * @param state state inside the DFA
   * @return map of alphabet symbols to target states (missing symbols have no transition)
   */
  Map<E, Q> transitionsMap(Q state);

  /**
   * States reachable from the initial state
   *
   * @return set of all reachable states in the FSM
   */
  default Set<Q> reachableStates() {
    final Set<Q> states = new HashSet<Q>();
    final Deque<Q> toVisit = new ArrayDeque<Q>();

    {
      final Q initial = initial();
      toVisit.push(initial);
      states.add(initial);
    }

    while (!toVisit.isEmpty()) {
      for (Q target : transitionsMap(toVisit.pop()).values()) {
        if (states.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return states;
  }
}
