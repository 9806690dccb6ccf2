package ca.gc.cra.logdrop.application.port;

/**
 * <strong>What:</strong> Port abstracting router metrics emission.
 * <p><strong>Why:</strong> Lets the dispatcher and outputs count accepted, dropped, and flushed records without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} serves tests
 * and components wired without metrics.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from input, dispatcher, and
 * output threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code dispatcher.record.accepted},
 * {@code output.file.dropped.full}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code dispatcher.record.dropped.missingField}); must not be
   *     {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., batch size, payload bytes)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
