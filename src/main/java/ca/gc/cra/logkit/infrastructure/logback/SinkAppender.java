package ca.gc.cra.logkit.infrastructure.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import java.util.Objects;

/**
 * One entry of the sink list. Several entries may forward to the same destination appender, which is how a sink
 * listed twice receives every record twice.
 */
final class SinkAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {
  private final Appender<ILoggingEvent> destination;

  SinkAppender(Appender<ILoggingEvent> destination) {
    this.destination = Objects.requireNonNull(destination, "destination");
  }

  @Override
  protected void append(ILoggingEvent event) {
    destination.doAppend(event);
  }
}
