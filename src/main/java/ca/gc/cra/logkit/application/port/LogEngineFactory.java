package ca.gc.cra.logkit.application.port;

import ca.gc.cra.logkit.domain.log.LoggerPlan;
import java.io.IOException;

/**
 * Builds a {@link LogEngine} for a plan.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogEngineFactory {
  /**
   * Starts an engine writing to every sink of {@code plan}.
   *
   * @param plan derived configuration
   * @return started engine
   * @throws IOException if any sink cannot be opened; no engine is left running in that case
   */
  LogEngine start(LoggerPlan plan) throws IOException;
}
