package dfasim;

import java.util.List;

/**
 * Outcome of simulating one input against an automaton.
 *
 * @param accepted whether the input was accepted
 * @param trace states visited, starting with the initial state
 * @param halt why the run stopped
 * @param <Q> states in the automata
 */
public record RunResult<Q>(boolean accepted, List<Q> trace, Halt halt) {

  /**
   * Reason a run stopped.
   */
  public enum Halt {
    /**
     * The whole input was consumed.
     */
    CONSUMED,

    /**
     * There was no transition for the next symbol, so the rest of the input
     * was left unread.
     */
    NO_TRANSITION,

    /**
     * The run entered the automaton's sink state.
     */
    SINK
  }

  public RunResult {
    trace = List.copyOf(trace);
  }

  /**
   * Last state in the trace.
   *
   * @return state the run ended in
   */
  public Q finalState() {
    return trace.get(trace.size() - 1);
  }
}
