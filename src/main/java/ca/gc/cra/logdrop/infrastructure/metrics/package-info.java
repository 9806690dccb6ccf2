/**
 * Metrics adapters bridging {@link ca.gc.cra.logdrop.application.port.MetricsPort} to OpenTelemetry or nothing.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code logdrop.dispatcher.*}, {@code logdrop.output.*} (tagged
 * {@code output}), and {@code logdrop.input.*}.</p>
 * <p><strong>Security:</strong> Exports counts only, never record contents.</p>
 */
package ca.gc.cra.logdrop.infrastructure.metrics;
