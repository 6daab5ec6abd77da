package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.application.port.LogEngine;
import ca.gc.cra.logkit.application.port.LogEngineFactory;
import ca.gc.cra.logkit.domain.log.Encoding;
import ca.gc.cra.logkit.domain.log.LoggerPlan;
import ca.gc.cra.logkit.domain.log.Sink;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.LogbackMDCAdapter;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.LayoutBase;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds a Logback engine from a {@link LoggerPlan}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create a private {@link LoggerContext} so instances never share level or appender state.</li>
 *   <li>Open one destination appender per distinct file or console stream, encoded per the plan.</li>
 *   <li>Attach one {@link SinkAppender} per sink entry, preserving duplicates.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from a name counter; safe for concurrent use.</p>
 * <p>Caller locations are resolved from the caller boundary that the emitting facade sets on each record.</p>
 *
 * @implNote A context created outside Logback's service provider has no MDC adapter; one is installed here because
 * appenders copy the MDC of every event. Logback reports file-open failures through its status manager rather than by throwing; a destination
 * that is not started after {@code start()} is treated as unopenable.
 * @since 0.1.0
 */
public final class LogbackEngineFactory implements LogEngineFactory {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LogbackEngineFactory.class);
  private static final String ENGINE_LOGGER_NAME = "logkit";
  private static final AtomicLong CONTEXT_IDS = new AtomicLong();

  @Override
  public LogEngine start(LoggerPlan plan) throws IOException {
    Objects.requireNonNull(plan, "plan");
    LoggerContext context = new LoggerContext();
    context.setName("logkit-" + CONTEXT_IDS.incrementAndGet());
    context.getStatusManager().add(new StderrStatusListener());
    context.setMDCAdapter(new LogbackMDCAdapter());
    context.start();

    Map<String, OutputStreamAppender<ILoggingEvent>> destinations = new LinkedHashMap<>();
    List<SinkAppender> sinkAppenders = new ArrayList<>(plan.sinks().size());
    try {
      for (Sink sink : plan.sinks()) {
        OutputStreamAppender<ILoggingEvent> destination = destinations.get(sink.destinationKey());
        if (destination == null) {
          destination = openDestination(context, plan, sink, destinations.size());
          destinations.put(sink.destinationKey(), destination);
        }
        SinkAppender appender = new SinkAppender(destination);
        appender.setContext(context);
        appender.setName("sink-" + sinkAppenders.size() + "-" + sink.target());
        appender.start();
        sinkAppenders.add(appender);
      }
    } catch (IOException ex) {
      destinations.values().forEach(OutputStreamAppender::stop);
      context.stop();
      throw ex;
    }

    ch.qos.logback.classic.Logger logger = context.getLogger(ENGINE_LOGGER_NAME);
    logger.setAdditive(false);
    logger.setLevel(Level.toLevel(plan.minimumLevel().slf4jLevel().name()));
    sinkAppenders.forEach(logger::addAppender);
    log.debug("Started log engine {} with {} sinks over {} destinations",
        context.getName(), sinkAppenders.size(), destinations.size());
    return new LogbackEngine(context, logger, new ArrayList<>(destinations.values()));
  }

  private static OutputStreamAppender<ILoggingEvent> openDestination(
      LoggerContext context, LoggerPlan plan, Sink sink, int index) throws IOException {
    LayoutBase<ILoggingEvent> layout = plan.encoding() == Encoding.JSON
        ? new JsonLineLayout(plan.zone(), plan.captureCaller())
        : new ConsoleLineLayout(plan.zone());
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setCharset(StandardCharsets.UTF_8);
    encoder.setLayout(layout);
    encoder.start();

    OutputStreamAppender<ILoggingEvent> appender = switch (sink.kind()) {
      case FILE -> {
        FileAppender<ILoggingEvent> file = new FileAppender<>();
        file.setFile(sink.target());
        file.setAppend(true);
        yield file;
      }
      case STDOUT -> console("System.out");
      case STDERR -> console("System.err");
    };
    appender.setContext(context);
    appender.setName("destination-" + index);
    appender.setEncoder(encoder);
    appender.start();
    if (!appender.isStarted()) {
      throw new IOException("unable to open log sink " + sink.target());
    }
    return appender;
  }

  private static ConsoleAppender<ILoggingEvent> console(String target) {
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setTarget(target);
    return console;
  }
}
