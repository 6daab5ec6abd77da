package ca.gc.cra.logkit.domain.id;

import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Atomic sequence cell backing the numeric suffix of request identifiers.
 * <p><strong>Why:</strong> The suffix is the only part of an identifier that guarantees uniqueness inside a
 * process, so the cell is owned explicitly instead of hiding in a static field of the generator.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; every call to {@link #incrementAndGet()} observes a distinct value.</p>
 *
 * @since 0.1.0
 */
public final class RequestCounter {
  private static final RequestCounter GLOBAL = new RequestCounter();

  private final AtomicLong value;

  /** Creates a counter whose first issued value is {@code 1}. */
  public RequestCounter() {
    this(0L);
  }

  /**
   * Creates a counter starting after {@code initial}.
   *
   * @param initial last value considered issued; must not be negative
   * @throws IllegalArgumentException if {@code initial} is negative
   */
  public RequestCounter(long initial) {
    if (initial < 0) {
      throw new IllegalArgumentException("initial must not be negative (was " + initial + ")");
    }
    this.value = new AtomicLong(initial);
  }

  /**
   * Returns the process-wide counter shared by default generators.
   *
   * @return counter living for the lifetime of the JVM; never reset
   */
  public static RequestCounter global() {
    return GLOBAL;
  }

  /**
   * Advances the counter by exactly one.
   *
   * @return the newly issued value
   */
  public long incrementAndGet() {
    return value.incrementAndGet();
  }

  /**
   * Returns the last issued value without advancing.
   *
   * @return last issued value, {@code 0} when nothing has been issued
   */
  public long current() {
    return value.get();
  }
}
