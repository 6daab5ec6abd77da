/**
 * <strong>Purpose:</strong> Decisions made when a logger is built: file path, level, encoding, injected fields,
 * sink fan-out, timestamp rendering and burst sampling.
 * <p><strong>Role:</strong> Application layer between {@link ca.gc.cra.logkit.config.LogOptions} and the engine
 * adapter; produces {@link ca.gc.cra.logkit.domain.log.LoggerPlan}.</p>
 * <p><strong>Concurrency:</strong> Planning is stateless; {@link ca.gc.cra.logkit.application.logging.RecordSampler}
 * uses atomic counters and is safe for concurrent emission.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.application.logging;
