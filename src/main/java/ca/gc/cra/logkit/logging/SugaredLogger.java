package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.domain.log.Field;
import ca.gc.cra.logkit.domain.log.LogLevel;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loosely-typed view over a {@link StructuredLogger}.
 *
 * <p>The {@code *w} methods take alternating keys and values; {@link Field} instances may be mixed in and are used
 * as-is. A trailing key without a value is kept under {@code ignored}. The {@code *f} methods format with
 * {@link String#format(String, Object...)}; the plain forms concatenate their arguments.</p>
 *
 * @since 0.1.0
 */
public final class SugaredLogger implements Closeable {
  static final String DANGLING_KEY = "ignored";

  private static final String BOUNDARY = SugaredLogger.class.getName();

  private final StructuredLogger base;

  SugaredLogger(StructuredLogger base) {
    this.base = Objects.requireNonNull(base, "base");
  }

  public void debugw(String message, Object... keysAndValues) {
    base.emit(LogLevel.DEBUG, message, pairs(keysAndValues), BOUNDARY);
  }

  public void infow(String message, Object... keysAndValues) {
    base.emit(LogLevel.INFO, message, pairs(keysAndValues), BOUNDARY);
  }

  public void warnw(String message, Object... keysAndValues) {
    base.emit(LogLevel.WARN, message, pairs(keysAndValues), BOUNDARY);
  }

  public void errorw(String message, Object... keysAndValues) {
    base.emit(LogLevel.ERROR, message, pairs(keysAndValues), BOUNDARY);
  }

  public void fatalw(String message, Object... keysAndValues) {
    base.fatalAt(message, pairs(keysAndValues), BOUNDARY);
  }

  public void debugf(String template, Object... args) {
    if (base.isEnabled(LogLevel.DEBUG)) {
      base.emit(LogLevel.DEBUG, format(template, args), List.of(), BOUNDARY);
    }
  }

  public void infof(String template, Object... args) {
    if (base.isEnabled(LogLevel.INFO)) {
      base.emit(LogLevel.INFO, format(template, args), List.of(), BOUNDARY);
    }
  }

  public void warnf(String template, Object... args) {
    if (base.isEnabled(LogLevel.WARN)) {
      base.emit(LogLevel.WARN, format(template, args), List.of(), BOUNDARY);
    }
  }

  public void errorf(String template, Object... args) {
    if (base.isEnabled(LogLevel.ERROR)) {
      base.emit(LogLevel.ERROR, format(template, args), List.of(), BOUNDARY);
    }
  }

  public void fatalf(String template, Object... args) {
    base.fatalAt(format(template, args), List.of(), BOUNDARY);
  }

  public void debug(Object... parts) {
    base.emit(LogLevel.DEBUG, concat(parts), List.of(), BOUNDARY);
  }

  public void info(Object... parts) {
    base.emit(LogLevel.INFO, concat(parts), List.of(), BOUNDARY);
  }

  public void warn(Object... parts) {
    base.emit(LogLevel.WARN, concat(parts), List.of(), BOUNDARY);
  }

  public void error(Object... parts) {
    base.emit(LogLevel.ERROR, concat(parts), List.of(), BOUNDARY);
  }

  public void fatal(Object... parts) {
    base.fatalAt(concat(parts), List.of(), BOUNDARY);
  }

  /**
   * Same as {@link StructuredLogger#log(String, Map, Throwable)}.
   *
   * @param message message used when no error is given
   * @param params extra fields; {@code null} for none
   * @param error error; {@code null} for none
   */
  public void log(String message, Map<String, ?> params, Throwable error) {
    base.logAt(message, params, error, BOUNDARY);
  }

  /**
   * Returns a sugared child logger adding the given pairs to every record.
   *
   * @param keysAndValues alternating keys and values, or {@link Field}s
   * @return child logger
   */
  public SugaredLogger with(Object... keysAndValues) {
    List<Field> fields = pairs(keysAndValues);
    return fields.isEmpty() ? this : new SugaredLogger(base.with(fields.toArray(new Field[0])));
  }

  public StructuredLogger desugar() {
    return base;
  }

  public Path outputFile() {
    return base.outputFile();
  }

  public ZoneId timeZone() {
    return base.timeZone();
  }

  public void sync() {
    base.sync();
  }

  @Override
  public void close() {
    base.close();
  }

  static List<Field> pairs(Object... keysAndValues) {
    if (keysAndValues == null || keysAndValues.length == 0) {
      return List.of();
    }
    List<Field> fields = new ArrayList<>();
    int i = 0;
    while (i < keysAndValues.length) {
      Object current = keysAndValues[i];
      if (current instanceof Field field) {
        fields.add(field);
        i++;
        continue;
      }
      if (i == keysAndValues.length - 1) {
        fields.add(Field.any(DANGLING_KEY, current));
        break;
      }
      Object value = keysAndValues[i + 1];
      String key = String.valueOf(current);
      if (key.isBlank()) {
        key = DANGLING_KEY;
      }
      if (value instanceof Throwable error) {
        fields.add(Field.named(key, error));
      } else {
        fields.add(Field.any(key, value));
      }
      i += 2;
    }
    return fields;
  }

  static String format(String template, Object... args) {
    if (template == null) {
      return concat(args);
    }
    if (args == null || args.length == 0) {
      return template;
    }
    try {
      return String.format(template, args);
    } catch (IllegalFormatException ex) {
      return template + " " + Arrays.toString(args);
    }
  }

  static String concat(Object... parts) {
    if (parts == null || parts.length == 0) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (Object part : parts) {
      sb.append(part);
    }
    return sb.toString();
  }
}
