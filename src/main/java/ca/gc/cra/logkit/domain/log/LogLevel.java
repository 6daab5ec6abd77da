package ca.gc.cra.logkit.domain.log;

import java.util.Locale;
import org.slf4j.event.Level;

/**
 * Severity levels exposed by logkit loggers.
 *
 * <p>{@link #FATAL} has no SLF4J counterpart; it is emitted at {@link Level#ERROR} and tagged with
 * {@link #FATAL_MARKER_NAME} so encoders can render it.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  DEBUG(Level.DEBUG),
  INFO(Level.INFO),
  WARN(Level.WARN),
  ERROR(Level.ERROR),
  FATAL(Level.ERROR);

  /** Marker name carried by fatal records. */
  public static final String FATAL_MARKER_NAME = "FATAL";

  private final Level slf4jLevel;

  LogLevel(Level slf4jLevel) {
    this.slf4jLevel = slf4jLevel;
  }

  /**
   * Returns the SLF4J level used when handing records to the engine.
   *
   * @return SLF4J level
   */
  public Level slf4jLevel() {
    return slf4jLevel;
  }

  /**
   * Returns the lower-case name used by the JSON encoder.
   *
   * @return level name such as {@code info}
   */
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
