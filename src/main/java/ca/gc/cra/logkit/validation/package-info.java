/**
 * <strong>Purpose:</strong> Input validation for logger construction: file-name segments and log directories.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> No logging; violations raise {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logkit.validation;
