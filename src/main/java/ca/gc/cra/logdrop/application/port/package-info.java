/**
 * <strong>Purpose:</strong> Ports defining the input -> dispatch -> output contracts of the router.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Each port documents which threads call it.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.logdrop.application.port.MetricsPort} carries counters from
 * every stage.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.application.port;
