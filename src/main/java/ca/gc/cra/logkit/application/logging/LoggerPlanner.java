package ca.gc.cra.logkit.application.logging;

import ca.gc.cra.logkit.application.port.ClockPort;
import ca.gc.cra.logkit.config.LogOptions;
import ca.gc.cra.logkit.domain.id.RequestIdGenerator;
import ca.gc.cra.logkit.domain.log.Encoding;
import ca.gc.cra.logkit.domain.log.LogLevel;
import ca.gc.cra.logkit.domain.log.LoggerPlan;
import ca.gc.cra.logkit.domain.log.SamplingPolicy;
import ca.gc.cra.logkit.domain.log.Sink;
import ca.gc.cra.logkit.validation.Strings;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Turns directory, prefix and {@link LogOptions} into a {@link LoggerPlan}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the zone and the dated output file.</li>
 *   <li>Select level, encoding, caller capture and sampling from the development flag.</li>
 *   <li>Derive injected fields and the ordered sink list.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use. Planning creates no files; the caller
 * prepares the directory.</p>
 *
 * @since 0.1.0
 */
public final class LoggerPlanner {
  private final ClockPort clock;
  private final RequestIdGenerator requestIds;

  /**
   * Creates a planner.
   *
   * @param clock clock deciding the calendar day of the file name
   * @param requestIds generator for {@code trace-id}
   */
  public LoggerPlanner(ClockPort clock, RequestIdGenerator requestIds) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
  }

  /**
   * Derives the plan.
   *
   * @param directory configured directory; empty selects the default
   * @param prefix file prefix; empty for none
   * @param options logger options
   * @return derived plan
   * @throws IllegalArgumentException if the zone is unknown, the prefix is not a valid file-name segment, or an output
   *         token is blank or contains control characters
   */
  public LoggerPlan plan(String directory, String prefix, LogOptions options) {
    Objects.requireNonNull(options, "options");
    ZoneId zone = LogTimestamps.resolveZone(options.zone());
    Path dir = LogFileNames.resolveDirectory(directory);
    Path outputFile = LogFileNames.outputFile(dir, prefix, clock.nowMillis(), zone);
    List<Sink> sinks = sinks(outputFile, options.outputs());
    Map<String, Object> fields = InitialFields.derive(options, requestIds);

    if (options.development()) {
      return new LoggerPlan(dir, outputFile, zone, LogLevel.DEBUG, Encoding.CONSOLE, null, false, fields, sinks);
    }
    return new LoggerPlan(
        dir, outputFile, zone, LogLevel.INFO, Encoding.JSON, SamplingPolicy.PRODUCTION, true, fields, sinks);
  }

  /**
   * Builds the sink list: the dated file first, then every extra output in order. Duplicates are kept, so a sink
   * listed twice receives every record twice.
   *
   * @param outputFile primary file
   * @param outputs extra output tokens
   * @return ordered sinks
   */
  static List<Sink> sinks(Path outputFile, List<String> outputs) {
    List<Sink> sinks = new ArrayList<>(outputs.size() + 1);
    sinks.add(Sink.file(outputFile));
    for (String output : outputs) {
      sinks.add(Sink.parse(Strings.requireNonBlank("output", output)));
    }
    return sinks;
  }
}
