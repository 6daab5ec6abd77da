package ca.gc.cra.logkit.logging;

import static ca.gc.cra.logkit.logging.LoggingFixtures.HOST;
import static ca.gc.cra.logkit.logging.LoggingFixtures.environment;
import static ca.gc.cra.logkit.logging.LoggingFixtures.lines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.application.logging.InitialFields;
import ca.gc.cra.logkit.config.LogOptions;
import ca.gc.cra.logkit.config.LogSettings;
import ca.gc.cra.logkit.domain.log.Field;
import ca.gc.cra.logkit.domain.log.LogLevel;
import ca.gc.cra.logkit.logging.LoggingFixtures.RecordingExit;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggersTest {
  private static final Pattern TS = Pattern.compile("\"ts\":\"\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}\"");

  @TempDir Path tempDir;

  private final RecordingExit exit = new RecordingExit();

  @Test
  void outputFileCombinesDirectoryPrefixAndZonedDate() {
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      assertEquals(tempDir.resolve("logs").resolve("api-2024-03-05.log"), logger.outputFile());
      assertEquals(ZoneId.of("Asia/Jakarta"), logger.timeZone());
      assertTrue(Files.isDirectory(tempDir.resolve("logs")));
    }
  }

  @Test
  void emptyPrefixUsesDateOnlyFileName() {
    try (StructuredLogger logger = build("", LogOptions.defaults())) {
      assertEquals("2024-03-05.log", logger.outputFile().getFileName().toString());
    }
  }

  @Test
  void loadedSettingsBuildWithDefaultEnvironment() {
    LogSettings settings = new LogSettings(
        tempDir.resolve("from-yaml").toString(), "svc", LogOptions.builder().development(true).build());

    try (StructuredLogger logger = Loggers.newLogger(settings)) {
      assertEquals(tempDir.resolve("from-yaml"), logger.outputFile().getParent());
      assertTrue(logger.outputFile().getFileName().toString().matches("svc-\\d{4}-\\d{2}-\\d{2}\\.log"));
      assertTrue(logger.isEnabled(LogLevel.DEBUG));
    }
  }

  @Test
  void nullOptionsMeanProductionDefaults() {
    try (StructuredLogger logger = build("api", null)) {
      assertFalse(logger.isEnabled(LogLevel.DEBUG));
      assertTrue(logger.initialFields().isEmpty());
    }
  }

  @Test
  void productionWritesJsonAndDropsDebug() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      file = logger.outputFile();
      logger.debug("hidden");
      logger.info("charged", Field.string("account", "A-1"), Field.number("amount", 12));
    }

    List<String> lines = lines(file);
    assertEquals(1, lines.size());
    String line = lines.get(0);
    assertTrue(line.startsWith("{\"level\":\"info\","), line);
    assertTrue(TS.matcher(line).find(), line);
    assertTrue(line.contains("\"caller\":\"LoggersTest.java:"), line);
    assertTrue(line.endsWith("\"msg\":\"charged\",\"account\":\"A-1\",\"amount\":12}"), line);
  }

  @Test
  void developmentWritesConsoleLinesIncludingDebug() {
    Path file;
    try (StructuredLogger logger = build("dev", LogOptions.builder().development(true).build())) {
      file = logger.outputFile();
      logger.debug("warming up", Field.bool("cold", true));
    }

    List<String> lines = lines(file);
    assertEquals(1, lines.size());
    String[] parts = lines.get(0).split("\t");
    assertEquals(4, parts.length);
    assertTrue(parts[0].matches("\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}"), parts[0]);
    assertEquals("DEBUG", parts[1]);
    assertEquals("warming up", parts[2]);
    assertEquals("{\"cold\":true}", parts[3]);
  }

  @Test
  void traceAndRefIdAreAttachedToEveryRecord() {
    Path file;
    String traceId;
    try (StructuredLogger logger = build("api", LogOptions.builder().withTrace(true).refId("R1").build())) {
      file = logger.outputFile();
      traceId = (String) logger.initialFields().get(InitialFields.TRACE_ID);
      logger.info("first");
      logger.warn("second");
    }

    assertTrue(traceId.startsWith(HOST + "."), traceId);
    for (String line : lines(file)) {
      assertTrue(line.contains("\"trace-id\":\"" + traceId + "\",\"ref-id\":\"R1\""), line);
    }
  }

  @Test
  void refIdOnlyOmitsTraceId() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.builder().refId("R1").build())) {
      file = logger.outputFile();
      logger.info("x");
    }

    String line = lines(file).get(0);
    assertTrue(line.contains("\"ref-id\":\"R1\""), line);
    assertFalse(line.contains("trace-id"), line);
  }

  @Test
  void traceOnlyOmitsRefId() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.builder().withTrace(true).build())) {
      file = logger.outputFile();
      logger.info("x");
    }

    String line = lines(file).get(0);
    assertTrue(line.contains("\"trace-id\":\"" + HOST + "."), line);
    assertFalse(line.contains("ref-id"), line);
  }

  @Test
  void eachLoggerGetsItsOwnTraceId() {
    LogOptions options = LogOptions.builder().withTrace(true).build();
    try (StructuredLogger first = build("a", options); StructuredLogger second = build("b", options)) {
      assertNotEquals(first.initialFields().get(InitialFields.TRACE_ID),
          second.initialFields().get(InitialFields.TRACE_ID));
    }
  }

  @Test
  void logWithoutErrorIsInfoWithParams() {
    Path file;
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("user", "u1");
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      file = logger.outputFile();
      logger.log("signed in", params, null);
      logger.log("plain", null, null);
    }

    List<String> lines = lines(file);
    assertTrue(lines.get(0).startsWith("{\"level\":\"info\""), lines.get(0));
    assertTrue(lines.get(0).endsWith("\"msg\":\"signed in\",\"user\":\"u1\"}"), lines.get(0));
    assertTrue(lines.get(1).endsWith("\"msg\":\"plain\"}"), lines.get(1));
  }

  @Test
  void logWithErrorIsErrorWithErrorText() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      file = logger.outputFile();
      logger.log("ignored", Map.of(), new IOException("disk full"));
      logger.log("ignored", Map.of("user", "u1"), new IOException("quota"));
    }

    List<String> lines = lines(file);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).startsWith("{\"level\":\"error\""), lines.get(0));
    assertTrue(lines.get(0).endsWith("\"msg\":\"disk full\"}"), lines.get(0));
    assertTrue(lines.get(1).endsWith("\"msg\":\"quota\",\"user\":\"u1\"}"), lines.get(1));
    assertFalse(lines.get(1).contains("ignored"));
  }

  @Test
  void errorFieldAddsStacktrace() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      file = logger.outputFile();
      logger.error("write failed", Field.error(new IOException("disk full")));
    }

    String line = lines(file).get(0);
    assertTrue(line.contains("\"error\":\"disk full\",\"stacktrace\":\"java.io.IOException: disk full"), line);
  }

  @Test
  void childLoggerAddsPermanentFields() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.builder().refId("R1").build())) {
      file = logger.outputFile();
      logger.with(Field.string("request", "q-1")).info("handled", Field.number("status", 200));
      logger.info("parent");
    }

    List<String> lines = lines(file);
    assertTrue(lines.get(0).contains("\"ref-id\":\"R1\",\"request\":\"q-1\",\"status\":200"), lines.get(0));
    assertFalse(lines.get(1).contains("request"), lines.get(1));
  }

  @Test
  void duplicateOutputWritesEveryRecordTwice() {
    Path dir = tempDir.resolve("logs");
    Path primary = dir.resolve("api-2024-03-05.log");
    LogOptions options = LogOptions.builder().addOutput(primary.toString()).build();
    try (StructuredLogger logger = build("api", options)) {
      logger.info("twice");
    }

    List<String> lines = lines(primary);
    assertEquals(2, lines.size());
    assertEquals(lines.get(0), lines.get(1));
  }

  @Test
  void extraFileOutputReceivesSameRecords() {
    Path extra = tempDir.resolve("extra.log");
    Path primary;
    try (StructuredLogger logger = build("api", LogOptions.builder().addOutput(extra.toString()).build())) {
      primary = logger.outputFile();
      logger.warn("fan out");
    }

    assertEquals(lines(primary), lines(extra));
  }

  @Test
  void stdoutOutputWritesToStandardOut() {
    PrintStream original = System.out;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try (StructuredLogger logger = build("api", LogOptions.builder().development(true).addOutput("stdout").build())) {
      logger.info("to console");
    } finally {
      System.setOut(original);
    }

    assertTrue(captured.toString(StandardCharsets.UTF_8).contains("\tINFO\tto console"));
  }

  @Test
  void productionSamplesRepeatedMessages() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      file = logger.outputFile();
      for (int i = 0; i < 150; i++) {
        logger.info("hot path");
      }
      logger.info("other message");
    }

    List<String> lines = lines(file);
    assertEquals(101, lines.size());
    assertTrue(lines.get(100).contains("other message"));
  }

  @Test
  void developmentDoesNotSample() {
    Path file;
    try (StructuredLogger logger = build("api", LogOptions.builder().development(true).build())) {
      file = logger.outputFile();
      for (int i = 0; i < 150; i++) {
        logger.info("hot path");
      }
    }

    assertEquals(150, lines(file).size());
  }

  @Test
  void fatalWritesFlushesAndExits() {
    StructuredLogger logger = build("api", LogOptions.defaults());
    Path file = logger.outputFile();

    logger.fatal("unrecoverable", Field.string("reason", "config"));

    assertEquals(List.of(1), exit.statuses);
    String line = lines(file).get(0);
    assertTrue(line.startsWith("{\"level\":\"fatal\""), line);
    assertTrue(line.contains("\"reason\":\"config\""), line);
  }

  @Test
  void syncMakesRecordsVisible() {
    try (StructuredLogger logger = build("api", LogOptions.defaults())) {
      logger.info("visible");
      logger.sync();

      assertEquals(1, lines(logger.outputFile()).size());
    }
  }

  @Test
  void unknownZoneIsConfigurationErrorAndCreatesNothing() {
    Path dir = tempDir.resolve("never");
    LoggerConstructionException ex = assertThrows(LoggerConstructionException.class, () ->
        Loggers.newLogger(dir.toString(), "api", LogOptions.builder().zone("Mars/Base").build(), environment(exit)));

    assertEquals(LoggerConstructionException.Kind.CONFIGURATION, ex.kind());
    assertFalse(Files.exists(dir));
  }

  @Test
  void prefixWithSeparatorIsConfigurationError() {
    LoggerConstructionException ex = assertThrows(LoggerConstructionException.class, () ->
        Loggers.newLogger(tempDir.toString(), "a/b", LogOptions.defaults(), environment(exit)));

    assertEquals(LoggerConstructionException.Kind.CONFIGURATION, ex.kind());
  }

  @Test
  void blankOutputIsConfigurationErrorAndCreatesNothing() {
    Path dir = tempDir.resolve("untouched");
    LoggerConstructionException ex = assertThrows(LoggerConstructionException.class, () ->
        Loggers.newLogger(dir.toString(), "api", LogOptions.builder().addOutput("   ").build(), environment(exit)));

    assertEquals(LoggerConstructionException.Kind.CONFIGURATION, ex.kind());
    assertTrue(ex.getMessage().contains("output must not be blank"), ex.getMessage());
    assertFalse(Files.exists(dir));
  }

  @Test
  void uncreatableDirectoryIsEnvironmentError() throws IOException {
    Path blocker = Files.createFile(tempDir.resolve("blocker"));

    LoggerConstructionException ex = assertThrows(LoggerConstructionException.class, () ->
        Loggers.newLogger(blocker.resolve("logs").toString(), "api", LogOptions.defaults(), environment(exit)));

    assertEquals(LoggerConstructionException.Kind.ENVIRONMENT, ex.kind());
  }

  @Test
  void unopenableOutputIsEnvironmentError() throws IOException {
    Path directoryAsFile = Files.createDirectory(tempDir.resolve("taken"));

    LoggerConstructionException ex = assertThrows(LoggerConstructionException.class, () ->
        build("api", LogOptions.builder().addOutput(directoryAsFile.toString()).build()));

    assertEquals(LoggerConstructionException.Kind.ENVIRONMENT, ex.kind());
  }

  private StructuredLogger build(String prefix, LogOptions options) {
    return Loggers.newLogger(tempDir.resolve("logs").toString(), prefix, options, environment(exit));
  }
}
