package ca.gc.cra.logkit.domain.log;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Fully derived configuration for one logger instance.
 * <p><strong>Why:</strong> Separates the decisions (path, level, encoding, fields, sinks) from the engine that
 * carries them out, so each decision can be checked without writing files.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param directory log directory
 * @param outputFile primary dated log file; always the first sink
 * @param zone zone used for file dates and record timestamps
 * @param minimumLevel lowest level written
 * @param encoding record encoding
 * @param sampling burst sampling, {@code null} when disabled
 * @param captureCaller whether records carry the calling source location
 * @param initialFields fields attached to every record, in insertion order
 * @param sinks ordered sink list, duplicates preserved
 * @since 0.1.0
 */
public record LoggerPlan(
    Path directory,
    Path outputFile,
    ZoneId zone,
    LogLevel minimumLevel,
    Encoding encoding,
    SamplingPolicy sampling,
    boolean captureCaller,
    Map<String, Object> initialFields,
    List<Sink> sinks) {

  public LoggerPlan {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(outputFile, "outputFile");
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(minimumLevel, "minimumLevel");
    Objects.requireNonNull(encoding, "encoding");
    initialFields = Collections.unmodifiableMap(new LinkedHashMap<>(
        Objects.requireNonNull(initialFields, "initialFields")));
    sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
  }

  /**
   * Returns whether burst sampling is active.
   *
   * @return {@code true} when {@link #sampling()} is set
   */
  public boolean sampled() {
    return sampling != null;
  }
}
