package ca.gc.cra.logdrop.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the router.
 *
 * <p>Reads {@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER} ({@code none} by default, or
 * {@code otlp}), {@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}, and
 * {@code otel.metric.export.interval} / {@code OTEL_METRIC_EXPORT_INTERVAL} in milliseconds. System properties win
 * over environment variables.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.logdrop";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none")
          .toLowerCase(Locale.ROOT);
      switch (exporter) {
        case "none":
          log.debug("OpenTelemetry metrics exporter disabled");
          return BootstrapResult.noop();
        case "otlp":
          return otlp();
        default:
          log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
          return BootstrapResult.noop();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    return build(reader);
  }

  private static BootstrapResult otlp() {
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    Duration interval = exportInterval();
    OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
    BootstrapResult result = build(PeriodicMetricReader.builder(exporter).setInterval(interval).build());
    log.info("OpenTelemetry metrics exporting to {} every {} ms", endpoint, interval.toMillis());
    return result;
  }

  private static BootstrapResult build(MetricReader reader) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource())
        .registerMetricReader(reader)
        .build();
    return BootstrapResult.active(provider, provider.get(INSTRUMENTATION_SCOPE));
  }

  private static Resource resource() {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "logdrop")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_INSTANCE_ID, instanceId());
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static Duration exportInterval() {
    String raw = setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL", "");
    if (raw.isEmpty()) {
      return DEFAULT_INTERVAL;
    }
    try {
      long millis = Long.parseLong(raw);
      if (millis > 0) {
        return Duration.ofMillis(millis);
      }
    } catch (NumberFormatException ex) {
      log.debug("Unparseable export interval '{}'", raw, ex);
    }
    log.warn("Ignoring invalid metric export interval '{}'; using {} ms", raw, DEFAULT_INTERVAL.toMillis());
    return DEFAULT_INTERVAL;
  }

  private static String instanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to runtime MXBean for instance id", ex);
      String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
      return runtimeName != null ? runtimeName : "unknown";
    }
  }

  private static String setting(String property, String env, String defaultValue) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
