package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.application.port.ClockPort;
import ca.gc.cra.logkit.application.port.ExitPort;
import ca.gc.cra.logkit.application.port.LogEngineFactory;
import ca.gc.cra.logkit.domain.id.RequestIdGenerator;
import ca.gc.cra.logkit.domain.id.RequestIds;
import ca.gc.cra.logkit.infrastructure.logback.LogbackEngineFactory;
import java.util.Objects;

/**
 * Collaborators used when building loggers. {@link #defaults()} is what production code wants; tests swap the
 * clock, exit handling or identifier generator.
 *
 * @param clock clock for file dates and sampling ticks
 * @param exit process termination after fatal records
 * @param requestIds generator for {@code trace-id}
 * @param engines engine factory
 * @since 0.1.0
 */
public record LoggerEnvironment(
    ClockPort clock,
    ExitPort exit,
    RequestIdGenerator requestIds,
    LogEngineFactory engines) {

  public LoggerEnvironment {
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(exit, "exit");
    Objects.requireNonNull(requestIds, "requestIds");
    Objects.requireNonNull(engines, "engines");
  }

  /**
   * System clock, {@link System#exit(int)}, the process-wide identifier generator and Logback.
   *
   * @return default environment
   */
  public static LoggerEnvironment defaults() {
    return new LoggerEnvironment(ClockPort.SYSTEM, ExitPort.SYSTEM, RequestIds.defaultGenerator(), logback());
  }

  public LoggerEnvironment withClock(ClockPort clock) {
    return new LoggerEnvironment(clock, exit, requestIds, engines);
  }

  public LoggerEnvironment withExit(ExitPort exit) {
    return new LoggerEnvironment(clock, exit, requestIds, engines);
  }

  public LoggerEnvironment withRequestIds(RequestIdGenerator requestIds) {
    return new LoggerEnvironment(clock, exit, requestIds, engines);
  }

  static LogEngineFactory logback() {
    return new LogbackEngineFactory();
  }
}
