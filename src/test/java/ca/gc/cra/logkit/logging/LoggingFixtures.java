package ca.gc.cra.logkit.logging;

import ca.gc.cra.logkit.application.port.ClockPort;
import ca.gc.cra.logkit.application.port.ExitPort;
import ca.gc.cra.logkit.domain.id.RequestCounter;
import ca.gc.cra.logkit.domain.id.RequestIdGenerator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class LoggingFixtures {
  /** 2024-03-05 10:00 in Jakarta. */
  static final long NOW = Instant.parse("2024-03-05T03:00:00Z").toEpochMilli();
  static final String HOST = "node-7";

  private LoggingFixtures() {}

  static LoggerEnvironment environment(RecordingExit exit) {
    return LoggerEnvironment.defaults()
        .withClock(ClockPort.fixed(NOW))
        .withExit(exit)
        .withRequestIds(new RequestIdGenerator(() -> HOST, new SecureRandom(), new RequestCounter()));
  }

  static List<String> lines(Path file) {
    try {
      return Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  static final class RecordingExit implements ExitPort {
    final List<Integer> statuses = new ArrayList<>();

    @Override
    public void exit(int status) {
      statuses.add(status);
    }
  }
}
