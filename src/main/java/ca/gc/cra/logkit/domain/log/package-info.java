/**
 * Value types describing log records and the derived configuration of a logger instance.
 * <p><strong>Role:</strong> Domain layer shared by the planner, the engine adapter and the public facade.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 */
package ca.gc.cra.logkit.domain.log;
