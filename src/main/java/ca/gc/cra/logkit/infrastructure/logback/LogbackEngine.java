package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.application.port.LogEngine;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.status.ErrorStatus;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * {@link LogEngine} backed by a private Logback {@link LoggerContext}.
 *
 * <p>Open engines are tracked in one registry served by a single JVM shutdown hook, which flushes and stops every
 * engine the owner never closed. {@link #close()} removes the engine from the registry.</p>
 *
 * @since 0.1.0
 */
final class LogbackEngine implements LogEngine {
  private static final Set<LogbackEngine> OPEN = ConcurrentHashMap.newKeySet();

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(LogbackEngine::closeAll, "logkit-shutdown"));
  }

  private final LoggerContext context;
  private final ch.qos.logback.classic.Logger logger;
  private final List<OutputStreamAppender<ILoggingEvent>> destinations;
  private final AtomicBoolean closed = new AtomicBoolean();

  LogbackEngine(
      LoggerContext context,
      ch.qos.logback.classic.Logger logger,
      List<OutputStreamAppender<ILoggingEvent>> destinations) {
    this.context = context;
    this.logger = logger;
    this.destinations = List.copyOf(destinations);
    OPEN.add(this);
  }

  @Override
  public Logger logger() {
    return logger;
  }

  @Override
  public void flush() {
    for (OutputStreamAppender<ILoggingEvent> destination : destinations) {
      OutputStream stream = destination.getOutputStream();
      if (stream == null) {
        continue;
      }
      try {
        stream.flush();
      } catch (IOException ex) {
        reportError("Failed to flush log sink " + destination.getName(), ex);
      }
    }
  }

  @Override
  public void reportError(String message, Throwable error) {
    context.getStatusManager().add(new ErrorStatus(message, this, error));
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    OPEN.remove(this);
    stopContext();
  }

  static int openCount() {
    return OPEN.size();
  }

  private static void closeAll() {
    for (LogbackEngine engine : OPEN) {
      engine.close();
    }
  }

  private void stopContext() {
    flush();
    context.stop();
    destinations.forEach(OutputStreamAppender::stop);
  }
}
