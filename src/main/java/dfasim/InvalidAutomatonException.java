package dfasim;

/**
 * Structural inconsistency detected while constructing an automaton.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 2417350981266471205L;

  /**
   * Which structural invariant was broken.
   */
  public enum Kind {
    START_NOT_IN_STATES,
    ACCEPT_NOT_SUBSET_OF_STATES,
    DANGLING_TRANSITION_STATE,
    DANGLING_TRANSITION_SYMBOL,
    SINK_NOT_IN_STATES,
    SINK_IS_ACCEPTING
  }

  private final Kind kind;

  public InvalidAutomatonException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
