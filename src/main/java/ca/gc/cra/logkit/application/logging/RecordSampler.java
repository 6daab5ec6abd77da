package ca.gc.cra.logkit.application.logging;

import ca.gc.cra.logkit.application.port.ClockPort;
import ca.gc.cra.logkit.domain.log.LogLevel;
import ca.gc.cra.logkit.domain.log.SamplingPolicy;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * <strong>What:</strong> Bounds record volume under sustained high-frequency logging.
 * <p><strong>How:</strong> Records are classified by level and message. Within one tick the first
 * {@code initial} records of a classification pass; after that only every {@code thereafter}-th passes.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; counters live in {@link AtomicLongArray}s.</p>
 * <p><strong>Performance:</strong> Messages hash into a fixed number of buckets per level, so memory stays constant
 * regardless of how many distinct messages are logged. Colliding messages share a budget.</p>
 *
 * @since 0.1.0
 */
public final class RecordSampler {
  static final int BUCKETS_PER_LEVEL = 4096;

  private static final RecordSampler PASS_THROUGH = new RecordSampler();

  private final SamplingPolicy policy;
  private final ClockPort clock;
  private final AtomicLongArray counts;
  private final AtomicLongArray resetAt;

  private RecordSampler() {
    this.policy = null;
    this.clock = null;
    this.counts = null;
    this.resetAt = null;
  }

  /**
   * Creates a sampler.
   *
   * @param policy sampling thresholds
   * @param clock clock defining tick boundaries
   */
  public RecordSampler(SamplingPolicy policy, ClockPort clock) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    int size = LogLevel.values().length * BUCKETS_PER_LEVEL;
    this.counts = new AtomicLongArray(size);
    this.resetAt = new AtomicLongArray(size);
  }

  /**
   * Returns a sampler admitting every record.
   *
   * @return pass-through sampler
   */
  public static RecordSampler passThrough() {
    return PASS_THROUGH;
  }

  /**
   * Returns a sampler for {@code policy}, or the pass-through sampler when {@code policy} is {@code null}.
   *
   * @param policy sampling policy; may be {@code null}
   * @param clock clock defining tick boundaries
   * @return sampler
   */
  public static RecordSampler forPolicy(SamplingPolicy policy, ClockPort clock) {
    return policy == null ? PASS_THROUGH : new RecordSampler(policy, clock);
  }

  /**
   * Counts a record and decides whether it is written.
   *
   * @param level record level
   * @param message record message
   * @return {@code true} when the record should be written
   */
  public boolean admit(LogLevel level, String message) {
    if (policy == null) {
      return true;
    }
    int index = level.ordinal() * BUCKETS_PER_LEVEL + bucket(message);
    long n = incrementAndCheckReset(index, clock.nowMillis());
    if (n <= policy.initial()) {
      return true;
    }
    return policy.thereafter() != 0 && (n - policy.initial()) % policy.thereafter() == 0;
  }

  private long incrementAndCheckReset(int index, long now) {
    long resetAfter = resetAt.get(index);
    if (resetAfter > now) {
      return counts.incrementAndGet(index);
    }
    counts.set(index, 1);
    if (!resetAt.compareAndSet(index, resetAfter, now + policy.tickMillis())) {
      return counts.incrementAndGet(index);
    }
    return 1;
  }

  private static int bucket(String message) {
    int h = message == null ? 0 : message.hashCode();
    h ^= (h >>> 16);
    return h & (BUCKETS_PER_LEVEL - 1);
  }
}
