/**
 * Request identifier generation used for log correlation.
 * <p><strong>Role:</strong> Domain layer; no dependency on the logging engine or configuration.</p>
 * <p><strong>Concurrency:</strong> Generators are thread-safe; uniqueness within a process comes from
 * {@link ca.gc.cra.logkit.domain.id.RequestCounter}.</p>
 * <p><strong>Security:</strong> Random segments come from {@link java.security.SecureRandom}; a failing source
 * raises {@link ca.gc.cra.logkit.domain.id.RequestIdException} instead of producing weaker identifiers.</p>
 */
package ca.gc.cra.logkit.domain.id;
