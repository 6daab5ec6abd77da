package ca.gc.cra.logkit.domain.log;

/**
 * Burst sampling applied per (level, message) and per tick.
 *
 * <p>Within each tick the first {@code initial} records of a classification are kept; after that only every
 * {@code thereafter}-th record is kept.</p>
 *
 * @param initial records logged verbatim per tick
 * @param thereafter keep one record out of this many once {@code initial} is exceeded; {@code 0} drops the rest
 * @param tickMillis window length in milliseconds
 * @since 0.1.0
 */
public record SamplingPolicy(int initial, int thereafter, long tickMillis) {
  /** Production policy: first 100 per second, then every 100th. */
  public static final SamplingPolicy PRODUCTION = new SamplingPolicy(100, 100, 1_000L);

  public SamplingPolicy {
    if (initial < 0 || thereafter < 0) {
      throw new IllegalArgumentException("sampling counts must not be negative");
    }
    if (tickMillis <= 0) {
      throw new IllegalArgumentException("tickMillis must be positive (was " + tickMillis + ")");
    }
  }
}
