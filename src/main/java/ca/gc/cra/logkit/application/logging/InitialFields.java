package ca.gc.cra.logkit.application.logging;

import ca.gc.cra.logkit.config.LogOptions;
import ca.gc.cra.logkit.domain.id.RequestIdGenerator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which correlation fields every record of a logger carries.
 *
 * <p>{@code trace-id} identifies the logger instance and is generated once, here. {@code ref-id} is the caller's
 * own reference and is copied verbatim. The two are independent: either, both or neither may be present.</p>
 *
 * @since 0.1.0
 */
public final class InitialFields {
  /** Key of the generated per-logger identifier. */
  public static final String TRACE_ID = "trace-id";
  /** Key of the caller-supplied reference identifier. */
  public static final String REF_ID = "ref-id";

  private InitialFields() {
    // Utility
  }

  /**
   * Derives the permanent fields for {@code options}.
   *
   * @param options logger options
   * @param requestIds generator consulted only when a trace id is requested
   * @return ordered, unmodifiable field map ({@code trace-id} before {@code ref-id})
   * @throws ca.gc.cra.logkit.domain.id.RequestIdException if trace id generation fails
   */
  public static Map<String, Object> derive(LogOptions options, RequestIdGenerator requestIds) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(requestIds, "requestIds");
    Map<String, Object> fields = new LinkedHashMap<>();
    if (options.withTrace()) {
      fields.put(TRACE_ID, requestIds.next());
    }
    if (options.hasRefId()) {
      fields.put(REF_ID, options.refId());
    }
    return Collections.unmodifiableMap(fields);
  }
}
