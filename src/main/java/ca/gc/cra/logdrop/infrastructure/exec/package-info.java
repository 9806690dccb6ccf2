/**
 * <strong>Purpose:</strong> Executor factories that name and configure router threads.
 * <p><strong>Concurrency:</strong> Produces executors with explicit thread names so thread dumps map to outputs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.exec;
