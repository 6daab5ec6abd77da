package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.application.logging.LogTimestamps;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * Production encoding: one JSON object per line.
 *
 * <pre>{"level":"info","ts":"2024/03/05 10:15:00","caller":"Billing.java:42","msg":"charged","trace-id":"..."}</pre>
 *
 * <p>Fields follow {@code msg} in emission order; {@code stacktrace} is appended when the record carries a
 * throwable.</p>
 *
 * @since 0.1.0
 */
public final class JsonLineLayout extends LayoutBase<ILoggingEvent> {
  static final String LEVEL_KEY = "level";
  static final String TIME_KEY = "ts";
  static final String CALLER_KEY = "caller";
  static final String MESSAGE_KEY = "msg";
  static final String STACKTRACE_KEY = "stacktrace";

  private final JsonFactory jsonFactory = new JsonFactory();
  private final ZoneId zone;
  private final boolean includeCaller;

  /**
   * Creates a layout.
   *
   * @param zone zone used for {@code ts}
   * @param includeCaller whether to write the {@code caller} key
   */
  public JsonLineLayout(ZoneId zone, boolean includeCaller) {
    this.zone = Objects.requireNonNull(zone, "zone");
    this.includeCaller = includeCaller;
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField(LEVEL_KEY, LoggingEvents.levelName(event).toLowerCase(Locale.ROOT));
      gen.writeStringField(TIME_KEY, LogTimestamps.formatRecordTime(event.getTimeStamp(), zone));
      if (includeCaller) {
        String caller = LoggingEvents.caller(event);
        if (caller != null) {
          gen.writeStringField(CALLER_KEY, caller);
        }
      }
      gen.writeStringField(MESSAGE_KEY, event.getFormattedMessage());
      JsonValues.writeFields(gen, event.getKeyValuePairs());
      IThrowableProxy throwable = event.getThrowableProxy();
      if (throwable != null) {
        gen.writeStringField(STACKTRACE_KEY, ThrowableProxyUtil.asString(throwable));
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      addError("Failed to encode log record as JSON", ex);
      return "";
    }
    return out.append('\n').toString();
  }
}
