/**
 * <strong>Purpose:</strong> Ports isolating logger construction from the clock, process exit and the logging engine.
 * <p><strong>Role:</strong> Implemented by infrastructure adapters; replaced with in-memory doubles in tests.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe; loggers call them from any thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.application.port;
