package ca.gc.cra.logkit.domain.log;

/**
 * Record encodings written to every sink of a logger.
 *
 * @since 0.1.0
 */
public enum Encoding {
  /** Tab-separated, human-readable lines used in development. */
  CONSOLE,
  /** One JSON object per line used in production. */
  JSON
}
