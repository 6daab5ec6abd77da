package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.application.logging.LogTimestamps;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Development encoding: {@code <ts>\t<LEVEL>\t<msg>[\t<fields as JSON>]}.
 *
 * <p>Caller locations and stack traces are not rendered.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleLineLayout extends LayoutBase<ILoggingEvent> {
  private static final char SEPARATOR = '\t';

  private final JsonFactory jsonFactory = new JsonFactory();
  private final ZoneId zone;

  /**
   * Creates a layout.
   *
   * @param zone zone used for timestamps
   */
  public ConsoleLineLayout(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    StringBuilder line = new StringBuilder(128)
        .append(LogTimestamps.formatRecordTime(event.getTimeStamp(), zone))
        .append(SEPARATOR)
        .append(LoggingEvents.levelName(event))
        .append(SEPARATOR)
        .append(event.getFormattedMessage());
    if (event.getKeyValuePairs() != null && !event.getKeyValuePairs().isEmpty()) {
      StringWriter fields = new StringWriter(64);
      try (JsonGenerator gen = jsonFactory.createGenerator(fields)) {
        gen.writeStartObject();
        JsonValues.writeFields(gen, event.getKeyValuePairs());
        gen.writeEndObject();
      } catch (IOException ex) {
        addError("Failed to encode log fields", ex);
        return "";
      }
      line.append(SEPARATOR).append(fields);
    }
    return line.append('\n').toString();
  }
}
