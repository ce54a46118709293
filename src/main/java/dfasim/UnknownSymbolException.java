package dfasim;

import java.util.Collections;
import java.util.List;

/**
 * Input symbol outside of the automaton's alphabet.
 *
 * <p>This aborts the run in which it was encountered, but says nothing about
 * the automaton itself, which stays usable.
 */
public class UnknownSymbolException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -6021735502473317045L;

  /**
   * Offending symbol.
   */
  public final Object symbol;

  /**
   * Offset of the symbol in the input.
   */
  public final int position;

  private final transient List<?> trace;

  /**
   * Constructor used by compiled acceptors, which do not track a trace.
   */
  public UnknownSymbolException(char symbol, int position) {
    this(Character.valueOf(symbol), position, Collections.emptyList());
  }

  public UnknownSymbolException(Object symbol, int position, List<?> trace) {
    super("Symbol '" + symbol + "' not in alphabet");
    this.symbol = symbol;
    this.position = position;
    this.trace = List.copyOf(trace);
  }

  /**
   * States visited before the unknown symbol was read.
   *
   * @return visited states (empty when the run was compiled)
   */
  public List<?> trace() {
    return trace == null ? Collections.emptyList() : trace;
  }
}
