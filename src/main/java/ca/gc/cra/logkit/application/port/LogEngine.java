package ca.gc.cra.logkit.application.port;

import java.io.Closeable;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Running logging engine configured from a {@link ca.gc.cra.logkit.domain.log.LoggerPlan}.
 * <p><strong>Role:</strong> Port implemented by the Logback adapter; the facade emits records through
 * {@link #logger()} and never touches appenders directly.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent emission, flush and close.</p>
 *
 * @since 0.1.0
 */
public interface LogEngine extends Closeable {
  /**
   * Returns the SLF4J logger whose level and sinks follow the plan.
   *
   * @return engine logger
   */
  Logger logger();

  /**
   * Flushes buffered bytes of every sink. Failures are reported through {@link #reportError(String, Throwable)}.
   */
  void flush();

  /**
   * Reports an internal failure on the engine's error channel instead of throwing to the caller.
   *
   * @param message description
   * @param error failure; may be {@code null}
   */
  void reportError(String message, Throwable error);

  /** Flushes and stops every sink. Idempotent. */
  @Override
  void close();
}
