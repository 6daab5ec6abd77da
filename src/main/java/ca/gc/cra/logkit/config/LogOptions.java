package ca.gc.cra.logkit.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of how a logger instance behaves.
 * <p><strong>Why:</strong> One value object covers every supported option so callers never hand-configure the
 * logging backend.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param development console encoding and DEBUG threshold when {@code true}; JSON, INFO and sampling otherwise
 * @param withTrace attach a freshly generated {@code trace-id} to every record
 * @param refId caller-supplied correlation id attached as {@code ref-id}; empty means none
 * @param outputs extra sinks written after the dated file, in order; {@code stdout}/{@code stderr} select the console
 * @param zone time-zone id for file dates and timestamps
 * @since 0.1.0
 */
public record LogOptions(
    boolean development,
    boolean withTrace,
    String refId,
    List<String> outputs,
    String zone) {

  public LogOptions {
    refId = refId == null ? "" : refId;
    outputs = outputs == null ? List.of() : List.copyOf(outputs);
    zone = zone == null || zone.isBlank() ? LogDefaults.ZONE : zone.trim();
  }

  /**
   * Production options without trace, ref-id or extra outputs.
   *
   * @return default options
   */
  public static LogOptions defaults() {
    return builder().build();
  }

  /**
   * Starts a builder seeded with defaults.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether a ref-id should be attached.
   *
   * @return {@code true} when {@link #refId()} is non-empty
   */
  public boolean hasRefId() {
    return !refId.isEmpty();
  }

  /**
   * Returns a builder seeded with this instance's values.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .development(development)
        .withTrace(withTrace)
        .refId(refId)
        .zone(zone);
    outputs.forEach(builder::addOutput);
    return builder;
  }

  /** Mutable builder for {@link LogOptions}. Not thread-safe. */
  public static final class Builder {
    private boolean development;
    private boolean withTrace;
    private String refId = "";
    private final List<String> outputs = new ArrayList<>();
    private String zone = LogDefaults.ZONE;

    private Builder() {}

    public Builder development(boolean development) {
      this.development = development;
      return this;
    }

    public Builder withTrace(boolean withTrace) {
      this.withTrace = withTrace;
      return this;
    }

    public Builder refId(String refId) {
      this.refId = refId;
      return this;
    }

    /**
     * Appends an extra sink. Adding the same output twice writes every record to it twice.
     *
     * @param output {@code stdout}, {@code stderr} or a file path
     * @return this builder
     */
    public Builder addOutput(String output) {
      outputs.add(Objects.requireNonNull(output, "output"));
      return this;
    }

    public Builder outputs(List<String> outputs) {
      this.outputs.clear();
      if (outputs != null) {
        outputs.forEach(this::addOutput);
      }
      return this;
    }

    public Builder zone(String zone) {
      this.zone = zone;
      return this;
    }

    public LogOptions build() {
      return new LogOptions(development, withTrace, refId, outputs, zone);
    }
  }
}
