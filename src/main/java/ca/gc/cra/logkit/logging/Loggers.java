package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.application.logging.LoggerPlanner;
import ca.gc.cra.logkit.application.logging.RecordSampler;
import ca.gc.cra.logkit.application.port.LogEngine;
import ca.gc.cra.logkit.config.LogOptions;
import ca.gc.cra.logkit.config.LogSettings;
import ca.gc.cra.logkit.domain.log.LoggerPlan;
import ca.gc.cra.logkit.validation.Paths;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds ready-to-use loggers writing to {@code <directory>/[<prefix>-]<yyyy-MM-dd>.log}
 * plus any extra outputs.
 * <p><strong>Steps:</strong> derive the plan (zone, path, level, encoding, fields, sinks), create the directory,
 * start the engine. Configuration problems are reported before anything touches the filesystem.</p>
 * <p><strong>Errors:</strong> {@link LoggerConstructionException} with {@link LoggerConstructionException.Kind#CONFIGURATION}
 * for bad options and {@link LoggerConstructionException.Kind#ENVIRONMENT} for directories or sinks that cannot be
 * used.</p>
 * <p><strong>Lifecycle:</strong> every logger owns open files until {@link StructuredLogger#close()}. Unclosed loggers
 * stay registered with one shared shutdown hook that flushes them at JVM exit; processes that build loggers
 * repeatedly should close each one.</p>
 *
 * <pre>
 * try (StructuredLogger logger = Loggers.newLogger("log/billing", "api",
 *     LogOptions.builder().withTrace(true).addOutput("stdout").build())) {
 *   logger.info("charged", Field.string("account", id));
 * }
 * </pre>
 *
 * @since 0.1.0
 */
public final class Loggers {
  private static final Logger log = LoggerFactory.getLogger(Loggers.class);

  private Loggers() {
    // Utility
  }

  /**
   * Builds a logger with the default environment.
   *
   * @param directory log directory; empty selects {@code log}
   * @param filePrefix file prefix; empty for none
   * @param options options; {@code null} selects {@link LogOptions#defaults()}
   * @return started logger
   * @throws LoggerConstructionException if the logger cannot be built
   */
  public static StructuredLogger newLogger(String directory, String filePrefix, LogOptions options) {
    return newLogger(directory, filePrefix, options, LoggerEnvironment.defaults());
  }

  /**
   * Builds a logger from loaded settings.
   *
   * @param settings directory, prefix and options
   * @return started logger
   * @throws LoggerConstructionException if the logger cannot be built
   */
  public static StructuredLogger newLogger(LogSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return newLogger(settings.directory(), settings.prefix(), settings.options());
  }

  /**
   * Builds a logger and returns its loosely-typed view.
   *
   * @param directory log directory; empty selects {@code log}
   * @param filePrefix file prefix; empty for none
   * @param options options; {@code null} selects {@link LogOptions#defaults()}
   * @return sugared view of a started logger
   * @throws LoggerConstructionException if the logger cannot be built
   */
  public static SugaredLogger newSugaredLogger(String directory, String filePrefix, LogOptions options) {
    return newLogger(directory, filePrefix, options).sugar();
  }

  /**
   * Builds a logger with explicit collaborators.
   *
   * @param directory log directory; empty selects {@code log}
   * @param filePrefix file prefix; empty for none
   * @param options options; {@code null} selects {@link LogOptions#defaults()}
   * @param environment clock, exit, identifier and engine collaborators
   * @return started logger
   * @throws LoggerConstructionException if the logger cannot be built
   * @throws ca.gc.cra.logkit.domain.id.RequestIdException if a trace id is requested and cannot be generated
   */
  public static StructuredLogger newLogger(
      String directory, String filePrefix, LogOptions options, LoggerEnvironment environment) {
    Objects.requireNonNull(environment, "environment");
    LogOptions effective = options == null ? LogOptions.defaults() : options;

    LoggerPlan plan;
    try {
      plan = new LoggerPlanner(environment.clock(), environment.requestIds())
          .plan(directory, filePrefix, effective);
    } catch (IllegalArgumentException ex) {
      throw new LoggerConstructionException(
          LoggerConstructionException.Kind.CONFIGURATION, "invalid logger configuration: " + ex.getMessage(), ex);
    }

    try {
      Paths.ensureWritableDirectory(plan.directory());
    } catch (IllegalArgumentException ex) {
      throw new LoggerConstructionException(
          LoggerConstructionException.Kind.ENVIRONMENT, "log directory unavailable: " + ex.getMessage(), ex);
    }

    LogEngine engine;
    try {
      engine = environment.engines().start(plan);
    } catch (IOException ex) {
      throw new LoggerConstructionException(
          LoggerConstructionException.Kind.ENVIRONMENT, "log engine failed to start: " + ex.getMessage(), ex);
    }

    log.debug("Logger ready: file={} zone={} level={} encoding={} sinks={}",
        plan.outputFile(), plan.zone(), plan.minimumLevel(), plan.encoding(), plan.sinks().size());
    return new StructuredLogger(
        plan, engine, RecordSampler.forPolicy(plan.sampling(), environment.clock()), environment.exit());
  }
}
