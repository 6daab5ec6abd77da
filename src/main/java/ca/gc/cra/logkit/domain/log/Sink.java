package ca.gc.cra.logkit.domain.log;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Destination a record is written to.
 *
 * @param kind destination type
 * @param target file path for {@link Kind#FILE}; the console token otherwise
 * @since 0.1.0
 */
public record Sink(Kind kind, String target) {
  /** Token selecting the process standard output. */
  public static final String STDOUT = "stdout";
  /** Token selecting the process standard error. */
  public static final String STDERR = "stderr";

  /** Destination types. */
  public enum Kind {
    FILE,
    STDOUT,
    STDERR
  }

  public Sink {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
    if (target.isBlank()) {
      throw new IllegalArgumentException("sink target must not be blank");
    }
  }

  /**
   * Interprets an output token: {@code stdout} and {@code stderr} select the console, anything else is a file path.
   *
   * @param token configured output name
   * @return parsed sink
   * @throws IllegalArgumentException if the token is blank
   */
  public static Sink parse(String token) {
    Objects.requireNonNull(token, "token");
    String trimmed = token.trim();
    if (STDOUT.equals(trimmed)) {
      return new Sink(Kind.STDOUT, STDOUT);
    }
    if (STDERR.equals(trimmed)) {
      return new Sink(Kind.STDERR, STDERR);
    }
    return new Sink(Kind.FILE, trimmed);
  }

  /**
   * Creates a file sink.
   *
   * @param path file path
   * @return file sink
   */
  public static Sink file(Path path) {
    return new Sink(Kind.FILE, path.toString());
  }

  /**
   * Returns a key identifying the physical destination; two sinks with the same key share one output stream.
   *
   * @return destination key
   */
  public String destinationKey() {
    if (kind != Kind.FILE) {
      return kind.name();
    }
    return "FILE:" + Path.of(target).toAbsolutePath().normalize();
  }
}
