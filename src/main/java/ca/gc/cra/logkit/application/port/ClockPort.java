package ca.gc.cra.logkit.application.port;

/**
 * <strong>What:</strong> Wall-clock source for log file dates and sampling windows.
 * <p><strong>Why:</strong> Lets tests pin the calendar day that names the log file and drive sampling ticks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; samplers read the clock on every record.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;

  /**
   * Returns a clock frozen at {@code epochMillis}.
   *
   * @param epochMillis fixed instant
   * @return fixed clock
   */
  static ClockPort fixed(long epochMillis) {
    return () -> epochMillis;
  }
}
