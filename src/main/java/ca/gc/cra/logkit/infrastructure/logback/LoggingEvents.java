package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.domain.log.LogLevel;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import org.slf4j.Marker;

/** Read helpers shared by the layouts. */
final class LoggingEvents {
  private LoggingEvents() {}

  /** Upper-case level name; {@code FATAL} when the record carries the fatal marker. */
  static String levelName(ILoggingEvent event) {
    List<Marker> markers = event.getMarkerList();
    if (markers != null) {
      for (Marker marker : markers) {
        if (LogLevel.FATAL_MARKER_NAME.equals(marker.getName())) {
          return LogLevel.FATAL.name();
        }
      }
    }
    return event.getLevel().toString();
  }

  /** {@code File.java:line} of the first frame outside the logger, or {@code null} when unknown. */
  static String caller(ILoggingEvent event) {
    StackTraceElement[] callerData = event.getCallerData();
    if (callerData == null || callerData.length == 0) {
      return null;
    }
    StackTraceElement top = callerData[0];
    String file = top.getFileName() != null ? top.getFileName() : top.getClassName();
    return file + ':' + top.getLineNumber();
  }
}
