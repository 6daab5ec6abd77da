package ca.gc.cra.logkit.domain.id;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * <strong>What:</strong> Produces request identifiers of the form {@code <host>.<random10>-<counter6>}.
 * <p><strong>Why:</strong> Gives every logger instance (and any caller that asks) a correlation id that is unique
 * within the process and distinguishable across hosts and restarts.</p>
 * <p><strong>Role:</strong> Domain service used by logger construction for {@code trace-id} injection.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Uniqueness relies on {@link RequestCounter}; the random
 * segment only separates processes.</p>
 *
 * @implNote Random segments are drawn as 12 bytes, encoded with the standard base64 alphabet, stripped of
 * {@code +} and {@code /}, and redrawn until at least ten characters survive.
 * @since 0.1.0
 */
public final class RequestIdGenerator {
  static final String FALLBACK_HOST = "localhost";
  static final int RANDOM_LENGTH = 10;
  private static final int RANDOM_BYTES = 12;
  private static final int SEQUENCE_WIDTH = 6;

  private final HostnameResolver hostnames;
  private final SecureRandom random;
  private final RequestCounter counter;

  /** Creates a generator using the system hostname, a new {@link SecureRandom} and the global counter. */
  public RequestIdGenerator() {
    this(HostnameResolver.SYSTEM, new SecureRandom(), RequestCounter.global());
  }

  /**
   * Creates a generator with explicit collaborators.
   *
   * @param hostnames hostname source; failures fall back to {@code localhost}
   * @param random secure random source
   * @param counter sequence cell supplying the numeric suffix
   */
  public RequestIdGenerator(HostnameResolver hostnames, SecureRandom random, RequestCounter counter) {
    this.hostnames = Objects.requireNonNull(hostnames, "hostnames");
    this.random = Objects.requireNonNull(random, "random");
    this.counter = Objects.requireNonNull(counter, "counter");
  }

  /**
   * Issues the next identifier and advances the counter by one.
   *
   * @return non-empty identifier unique within the process
   * @throws RequestIdException if the random source fails
   */
  public String next() {
    String host = resolveHost();
    String segment = randomSegment();
    long sequence = counter.incrementAndGet();
    return new RequestId(host, segment, sequence).toString();
  }

  private String resolveHost() {
    String host;
    try {
      host = hostnames.hostname();
    } catch (Exception ex) {
      return FALLBACK_HOST;
    }
    return host == null || host.isBlank() ? FALLBACK_HOST : host.trim();
  }

  private String randomSegment() {
    byte[] buf = new byte[RANDOM_BYTES];
    Base64.Encoder encoder = Base64.getEncoder();
    String encoded = "";
    while (encoded.length() < RANDOM_LENGTH) {
      try {
        random.nextBytes(buf);
      } catch (RuntimeException ex) {
        throw new RequestIdException("secure random source failed", ex);
      }
      encoded = encoder.encodeToString(buf).replace("+", "").replace("/", "");
    }
    return encoded.substring(0, RANDOM_LENGTH);
  }

  static String padSequence(long sequence) {
    String digits = Long.toString(sequence);
    if (digits.length() >= SEQUENCE_WIDTH) {
      return digits;
    }
    return "0".repeat(SEQUENCE_WIDTH - digits.length()) + digits;
  }
}
