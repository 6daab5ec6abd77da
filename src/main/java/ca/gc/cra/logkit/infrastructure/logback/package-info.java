/**
 * <strong>Purpose:</strong> Logback adapter that carries out a {@link ca.gc.cra.logkit.domain.log.LoggerPlan}.
 * <p><strong>Pipeline role:</strong> Each logger instance gets a private {@code LoggerContext}; every sink of the
 * plan becomes one appender, and sinks naming the same destination share one output stream.</p>
 * <p><strong>Concurrency:</strong> Appenders serialize writes per destination; emission is thread-safe.</p>
 * <p><strong>Observability:</strong> Write and encode failures go to the context status manager and are printed on
 * standard error by {@link ca.gc.cra.logkit.infrastructure.logback.StderrStatusListener}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.infrastructure.logback;
