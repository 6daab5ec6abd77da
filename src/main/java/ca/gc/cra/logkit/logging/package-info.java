/**
 * <strong>Purpose:</strong> Public entry points: build a logger with {@link ca.gc.cra.logkit.logging.Loggers} and
 * emit through {@link ca.gc.cra.logkit.logging.StructuredLogger} or {@link ca.gc.cra.logkit.logging.SugaredLogger}.
 * <p><strong>Errors:</strong> Construction fails loudly with
 * {@link ca.gc.cra.logkit.logging.LoggerConstructionException}; emission never throws.</p>
 * <p><strong>Concurrency:</strong> Loggers are immutable after construction and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.logging;
