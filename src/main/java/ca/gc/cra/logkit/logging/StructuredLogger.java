package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.application.logging.RecordSampler;
import ca.gc.cra.logkit.application.port.ExitPort;
import ca.gc.cra.logkit.application.port.LogEngine;
import ca.gc.cra.logkit.domain.log.Field;
import ca.gc.cra.logkit.domain.log.LogLevel;
import ca.gc.cra.logkit.domain.log.LoggerPlan;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.spi.CallerBoundaryAware;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * <strong>What:</strong> Leveled, structured logger built by {@link Loggers}.
 * <p><strong>Fields:</strong> every record carries the plan's initial fields ({@code trace-id}, {@code ref-id}),
 * then fields added with {@link #with(Field...)}, then the call's own fields.</p>
 * <p><strong>Errors:</strong> emission never throws; engine failures go to the engine's error channel.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use. Child loggers from {@link #with(Field...)}
 * share the engine, so closing any of them closes all.</p>
 *
 * @since 0.1.0
 */
public final class StructuredLogger implements Closeable {
  private static final Marker FATAL_MARKER = MarkerFactory.getMarker(LogLevel.FATAL_MARKER_NAME);
  private static final String BOUNDARY = StructuredLogger.class.getName();

  private final LoggerPlan plan;
  private final LogEngine engine;
  private final RecordSampler sampler;
  private final ExitPort exit;
  private final List<Field> permanentFields;

  StructuredLogger(LoggerPlan plan, LogEngine engine, RecordSampler sampler, ExitPort exit) {
    this(plan, engine, sampler, exit, initialFields(plan.initialFields()));
  }

  private StructuredLogger(
      LoggerPlan plan, LogEngine engine, RecordSampler sampler, ExitPort exit, List<Field> permanentFields) {
    this.plan = Objects.requireNonNull(plan, "plan");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.sampler = Objects.requireNonNull(sampler, "sampler");
    this.exit = Objects.requireNonNull(exit, "exit");
    this.permanentFields = List.copyOf(permanentFields);
  }

  public void debug(String message, Field... fields) {
    emit(LogLevel.DEBUG, message, fields, BOUNDARY);
  }

  public void info(String message, Field... fields) {
    emit(LogLevel.INFO, message, fields, BOUNDARY);
  }

  public void warn(String message, Field... fields) {
    emit(LogLevel.WARN, message, fields, BOUNDARY);
  }

  public void error(String message, Field... fields) {
    emit(LogLevel.ERROR, message, fields, BOUNDARY);
  }

  /**
   * Writes a fatal record, flushes every sink and terminates the process with status {@code 1}.
   *
   * @param message record message
   * @param fields record fields
   */
  public void fatal(String message, Field... fields) {
    fatalAt(message, fields == null ? List.of() : Arrays.asList(fields), BOUNDARY);
  }

  /**
   * Logs a message with optional parameters and an optional error, choosing the level from the error.
   *
   * <ul>
   *   <li>error absent: INFO with {@code message} and the parameters as fields;</li>
   *   <li>error present, no parameters: ERROR whose message is the error text;</li>
   *   <li>error present with parameters: ERROR whose message is the error text, parameters as fields.</li>
   * </ul>
   *
   * @param message message used when no error is given
   * @param params extra fields; {@code null} for none
   * @param error error; {@code null} for none
   */
  public void log(String message, Map<String, ?> params, Throwable error) {
    logAt(message, params, error, BOUNDARY);
  }

  /**
   * Returns a child logger adding {@code fields} to every record.
   *
   * @param fields permanent fields
   * @return child logger sharing this logger's engine
   */
  public StructuredLogger with(Field... fields) {
    if (fields == null || fields.length == 0) {
      return this;
    }
    List<Field> combined = new ArrayList<>(permanentFields);
    combined.addAll(Arrays.asList(fields));
    return new StructuredLogger(plan, engine, sampler, exit, combined);
  }

  /**
   * Returns the loosely-typed view of this logger.
   *
   * @return sugared logger
   */
  public SugaredLogger sugar() {
    return new SugaredLogger(this);
  }

  /**
   * Returns whether records at {@code level} are written.
   *
   * @param level level to check
   * @return {@code true} when {@code level} passes the minimum level
   */
  public boolean isEnabled(LogLevel level) {
    return engine.logger().isEnabledForLevel(level.slf4jLevel());
  }

  /**
   * Returns the dated primary output file.
   *
   * @return output path, fixed at construction
   */
  public Path outputFile() {
    return plan.outputFile();
  }

  /**
   * Returns the zone used for file dates and record timestamps.
   *
   * @return zone, fixed at construction
   */
  public ZoneId timeZone() {
    return plan.zone();
  }

  /**
   * Returns the fields injected at construction.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, Object> initialFields() {
    return plan.initialFields();
  }

  /**
   * Returns the plan this logger was built from.
   *
   * @return plan
   */
  public LoggerPlan plan() {
    return plan;
  }

  /** Flushes buffered bytes of every sink. */
  public void sync() {
    engine.flush();
  }

  /** Flushes and stops every sink. Further records are dropped. */
  @Override
  public void close() {
    engine.close();
  }

  void logAt(String message, Map<String, ?> params, Throwable error, String boundary) {
    List<Field> fields = flatten(params);
    if (error != null) {
      emit(LogLevel.ERROR, Field.errorText(error), fields, boundary);
    } else {
      emit(LogLevel.INFO, message, fields, boundary);
    }
  }

  void fatalAt(String message, List<Field> fields, String boundary) {
    emit(LogLevel.FATAL, message, fields, boundary);
    close();
    exit.exit(ExitPort.FATAL_STATUS);
  }

  void emit(LogLevel level, String message, Field[] fields, String boundary) {
    emit(level, message, fields == null ? List.of() : Arrays.asList(fields), boundary);
  }

  void emit(LogLevel level, String message, List<Field> fields, String boundary) {
    try {
      if (!isEnabled(level)) {
        return;
      }
      if (level != LogLevel.FATAL && !sampler.admit(level, message)) {
        return;
      }
      LoggingEventBuilder builder = engine.logger().atLevel(level.slf4jLevel());
      if (builder instanceof CallerBoundaryAware aware) {
        aware.setCallerBoundary(boundary);
      }
      if (level == LogLevel.FATAL) {
        builder = builder.addMarker(FATAL_MARKER);
      }
      for (Field field : permanentFields) {
        builder = builder.addKeyValue(field.key(), field.value());
      }
      Throwable cause = null;
      for (Field field : fields) {
        if (field == null) {
          continue;
        }
        builder = builder.addKeyValue(field.key(), field.value());
        if (field.cause() != null) {
          cause = field.cause();
        }
      }
      if (cause != null) {
        builder = builder.setCause(cause);
      }
      builder.log(message == null ? "" : message);
    } catch (RuntimeException ex) {
      engine.reportError("Failed to emit " + level + " record", ex);
    }
  }

  private static List<Field> flatten(Map<String, ?> params) {
    if (params == null || params.isEmpty()) {
      return List.of();
    }
    List<Field> fields = new ArrayList<>(params.size());
    for (Map.Entry<String, ?> entry : params.entrySet()) {
      fields.add(Field.any(String.valueOf(entry.getKey()), entry.getValue()));
    }
    return fields;
  }

  private static List<Field> initialFields(Map<String, Object> initial) {
    if (initial.isEmpty()) {
      return Collections.emptyList();
    }
    List<Field> fields = new ArrayList<>(initial.size());
    initial.forEach((key, value) -> fields.add(Field.any(key, value)));
    return fields;
  }
}
