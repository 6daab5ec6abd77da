package ca.gc.cra.logkit.logging;

import java.util.Objects;

/**
 * Raised when a logger cannot be built. No partially configured logger is ever returned.
 *
 * @since 0.1.0
 */
public final class LoggerConstructionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure classes. */
  public enum Kind {
    /** Usage error: unknown zone, invalid prefix or output token. */
    CONFIGURATION,
    /** Deployment error: directory cannot be created or a sink cannot be opened. */
    ENVIRONMENT
  }

  private final Kind kind;

  /**
   * Creates an exception.
   *
   * @param kind failure class
   * @param message description
   * @param cause underlying failure
   */
  public LoggerConstructionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure class.
   *
   * @return kind
   */
  public Kind kind() {
    return kind;
  }
}
