package ca.gc.cra.logkit.domain.id;

/**
 * Static entry point for callers that only need an identifier.
 *
 * @since 0.1.0
 */
public final class RequestIds {
  private RequestIds() {
    // Utility
  }

  /**
   * Issues an identifier from the process-wide default generator.
   *
   * @return identifier unique within the process
   * @throws RequestIdException if the random source fails
   */
  public static String next() {
    return Holder.DEFAULT.next();
  }

  /**
   * Returns the shared default generator.
   *
   * @return generator bound to the system hostname and the global counter
   */
  public static RequestIdGenerator defaultGenerator() {
    return Holder.DEFAULT;
  }

  private static final class Holder {
    static final RequestIdGenerator DEFAULT = new RequestIdGenerator();
  }
}
