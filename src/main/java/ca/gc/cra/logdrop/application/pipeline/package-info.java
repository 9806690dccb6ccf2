/**
 * <strong>Purpose:</strong> Record routing from the ingestion channel to outputs.
 * <p><strong>Pipeline role:</strong> Application layer between input adapters and output adapters.</p>
 * <p><strong>Concurrency:</strong> One dispatcher thread plus one worker thread per output; each output owns a
 * bounded channel.</p>
 * <p><strong>Metrics:</strong> Emits {@code dispatcher.record.*} and {@code output.<name>.dropped.full}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.application.pipeline;
