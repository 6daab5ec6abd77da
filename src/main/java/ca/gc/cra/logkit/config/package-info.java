/**
 * <strong>Purpose:</strong> Logger options and their YAML loading.
 * <p><strong>Role:</strong> Configuration layer feeding {@link ca.gc.cra.logkit.logging.Loggers}.</p>
 * <p><strong>Concurrency:</strong> Option values are immutable; loaders are stateless.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.config;
