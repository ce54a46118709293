package dfasim.codec;

import java.io.IOException;

/**
 * Stored automaton which is not valid JSON or does not have the expected shape.
 */
public class MalformedDocumentException extends IOException {

  @java.io.Serial
  private static final long serialVersionUID = 7185531870342203514L;

  public MalformedDocumentException(String message) {
    super(message);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
