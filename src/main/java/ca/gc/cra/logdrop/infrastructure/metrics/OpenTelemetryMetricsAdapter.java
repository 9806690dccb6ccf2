package ca.gc.cra.logdrop.infrastructure.metrics;

import ca.gc.cra.logdrop.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter forwarding router counters and histograms to OpenTelemetry.
 *
 * <p>Per-output keys ({@code output.<name>.dropped.full}) share one instrument tagged with an {@code output}
 * attribute; see {@link MetricKey}. Instruments are created on first use and cached.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> OUTPUT_ATTRIBUTE = AttributeKey.stringKey("output");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongCounter> counterByName = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histogramByName = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the environment-configured exporter. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Reports whether metrics are actually exported.
   *
   * @return {@code true} when the exporter is disabled
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(key, this::createCounter);
    instrument.meter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(key, this::createHistogram);
    instrument.meter().record(value, instrument.attributes());
  }

  private Instrument<LongCounter> createCounter(String key) {
    MetricKey parsed = MetricKey.parse(key);
    LongCounter counter = counterByName.computeIfAbsent(parsed.instrument(), name -> meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("logdrop counter " + name)
        .build());
    return new Instrument<>(counter, attributes(parsed));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    MetricKey parsed = MetricKey.parse(key);
    LongHistogram histogram = histogramByName.computeIfAbsent(parsed.instrument(), name -> meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("logdrop observation " + name)
        .build());
    return new Instrument<>(histogram, attributes(parsed));
  }

  private static Attributes attributes(MetricKey key) {
    return key.output() == null ? Attributes.empty() : Attributes.of(OUTPUT_ATTRIBUTE, key.output());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private record Instrument<T>(T meter, Attributes attributes) {}
}
