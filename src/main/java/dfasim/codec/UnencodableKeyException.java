package dfasim.codec;

/**
 * A state or symbol contains the separator of the legacy
 * {@code "<state>,<symbol>"} key, so it cannot be written in that format.
 */
public class UnencodableKeyException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 4470956316802551029L;

  public UnencodableKeyException(String message) {
    super(message);
  }
}
