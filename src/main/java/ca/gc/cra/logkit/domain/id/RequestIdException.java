package ca.gc.cra.logkit.domain.id;

/**
 * Raised when a request identifier cannot be produced with full randomness.
 *
 * @since 0.1.0
 */
public final class RequestIdException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the failing random source.
   *
   * @param message diagnostic text
   * @param cause underlying failure
   */
  public RequestIdException(String message, Throwable cause) {
    super(message, cause);
  }
}
