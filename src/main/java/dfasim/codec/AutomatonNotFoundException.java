package dfasim.codec;

import java.io.IOException;

/**
 * No stored automaton exists under the requested name.
 */
public class AutomatonNotFoundException extends IOException {

  @java.io.Serial
  private static final long serialVersionUID = -3350146125460218735L;

  public AutomatonNotFoundException(String location) {
    super("File " + location + " not found.");
  }

  public AutomatonNotFoundException(String location, Throwable cause) {
    super("File " + location + " not found.", cause);
  }
}
