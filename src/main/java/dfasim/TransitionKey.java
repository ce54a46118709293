package dfasim;

/**
 * Source half of a transition: the state being left and the symbol read.
 *
 * @param state state the transition starts from
 * @param symbol input symbol consumed by the transition
 */
public record TransitionKey(String state, char symbol) implements Comparable<TransitionKey> {

  public TransitionKey {
    if (state == null) {
      throw new NullPointerException("transition state cannot be null");
    }
  }

  @Override
  public int compareTo(TransitionKey other) {
    final int byState = state.compareTo(other.state);
    return byState != 0 ? byState : Character.compare(symbol, other.symbol);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + symbol + ")";
  }
}
