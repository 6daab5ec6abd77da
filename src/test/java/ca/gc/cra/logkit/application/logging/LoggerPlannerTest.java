package ca.gc.cra.logkit.application.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.application.port.ClockPort;
import ca.gc.cra.logkit.config.LogOptions;
import ca.gc.cra.logkit.domain.id.RequestCounter;
import ca.gc.cra.logkit.domain.id.RequestIdGenerator;
import ca.gc.cra.logkit.domain.log.Encoding;
import ca.gc.cra.logkit.domain.log.LogLevel;
import ca.gc.cra.logkit.domain.log.LoggerPlan;
import ca.gc.cra.logkit.domain.log.SamplingPolicy;
import ca.gc.cra.logkit.domain.log.Sink;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoggerPlannerTest {
  private static final long NOW = Instant.parse("2024-03-05T20:00:00Z").toEpochMilli();

  private final LoggerPlanner planner = new LoggerPlanner(
      ClockPort.fixed(NOW), new RequestIdGenerator(() -> "node", new SecureRandom(), new RequestCounter()));

  @Test
  void productionUsesJsonInfoSamplingAndCaller() {
    LoggerPlan plan = planner.plan("logs", "api", LogOptions.defaults());

    assertEquals(LogLevel.INFO, plan.minimumLevel());
    assertEquals(Encoding.JSON, plan.encoding());
    assertEquals(SamplingPolicy.PRODUCTION, plan.sampling());
    assertTrue(plan.captureCaller());
    assertTrue(plan.sampled());
  }

  @Test
  void developmentUsesConsoleDebugWithoutSampling() {
    LoggerPlan plan = planner.plan("logs", "api", LogOptions.builder().development(true).build());

    assertEquals(LogLevel.DEBUG, plan.minimumLevel());
    assertEquals(Encoding.CONSOLE, plan.encoding());
    assertNull(plan.sampling());
    assertFalse(plan.captureCaller());
  }

  @Test
  void outputFileUsesDefaultZoneDate() {
    LoggerPlan plan = planner.plan("logs", "api", LogOptions.defaults());

    // 20:00 UTC is already the next day in Jakarta.
    assertEquals(Path.of("logs", "api-2024-03-06.log"), plan.outputFile());
    assertEquals(ZoneId.of("Asia/Jakarta"), plan.zone());
  }

  @Test
  void outputFileUsesConfiguredZone() {
    LoggerPlan plan = planner.plan("logs", "", LogOptions.builder().zone("UTC").build());

    assertEquals(Path.of("logs", "2024-03-05.log"), plan.outputFile());
  }

  @Test
  void blankDirectoryFallsBackToLog() {
    LoggerPlan plan = planner.plan("", "", LogOptions.defaults());

    assertEquals(Path.of("log"), plan.directory());
    assertEquals(Path.of("log", "2024-03-06.log"), plan.outputFile());
  }

  @Test
  void sinksKeepPrimaryFirstThenOutputsWithDuplicates() {
    LoggerPlan plan = planner.plan("logs", "api",
        LogOptions.builder().addOutput("stdout").addOutput("extra.log").addOutput("stdout").build());

    assertEquals(List.of(
        Sink.file(Path.of("logs", "api-2024-03-06.log")),
        new Sink(Sink.Kind.STDOUT, Sink.STDOUT),
        new Sink(Sink.Kind.FILE, "extra.log"),
        new Sink(Sink.Kind.STDOUT, Sink.STDOUT)), plan.sinks());
  }

  @Test
  void unknownZoneIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> planner.plan("logs", "api", LogOptions.builder().zone("Nowhere/City").build()));
  }

  @Test
  void blankOutputIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> planner.plan("logs", "api", LogOptions.builder().addOutput(" ").build()));
  }

  @Test
  void outputWithControlCharactersIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> planner.plan("logs", "api", LogOptions.builder().addOutput("audit\u0007.log").build()));
  }

  @Test
  void outputTokensAreTrimmed() {
    LoggerPlan plan = planner.plan("logs", "api", LogOptions.builder().addOutput("  stderr ").build());

    assertEquals(new Sink(Sink.Kind.STDERR, Sink.STDERR), plan.sinks().get(1));
  }

  @Test
  void traceIdIsGeneratedOncePerPlan() {
    LoggerPlan plan = planner.plan("logs", "api", LogOptions.builder().withTrace(true).build());

    assertTrue(plan.initialFields().get(InitialFields.TRACE_ID).toString().startsWith("node."));
  }
}
