package ca.gc.cra.logdrop.config;

import ca.gc.cra.logdrop.validation.Numbers;
import ca.gc.cra.logdrop.validation.Strings;
import java.net.URI;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed definition of one configured output.
 * <p><strong>Role:</strong> Configuration value consumed by {@link CompositionRoot} to build
 * {@link ca.gc.cra.logdrop.application.port.OutputPort} adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface OutputConfig
    permits OutputConfig.FileOutputConfig, OutputConfig.BulkOutputConfig, OutputConfig.NullOutputConfig {

  /**
   * Returns the output name, unique within one configuration.
   *
   * @return name used for threads, logs, and metrics
   */
  String name();

  /**
   * Returns the capacity of the output's private delivery channel.
   *
   * @return queue capacity
   */
  int queueCapacity();

  /**
   * File output writing one rendered line per record.
   *
   * @param name output name
   * @param path path template, e.g. {@code /var/log/{source}.log}
   * @param format line template
   * @param queueCapacity channel capacity
   */
  record FileOutputConfig(String name, String path, String format, int queueCapacity) implements OutputConfig {
    public FileOutputConfig {
      name = Strings.requireIdentifier("outputs.name", name);
      path = Strings.requireNonBlank("outputs." + name + ".path", path);
      Objects.requireNonNull(format, "format");
      Numbers.requireRange("outputs." + name + ".queueCapacity", queueCapacity, 1, Integer.MAX_VALUE);
    }
  }

  /**
   * Bulk index output.
   *
   * @param name output name
   * @param endpoint bulk endpoint URI
   * @param limit batch size that forces a flush
   * @param intervalMillis maximum batch age in milliseconds
   * @param queueCapacity channel capacity
   */
  record BulkOutputConfig(String name, URI endpoint, int limit, long intervalMillis, int queueCapacity)
      implements OutputConfig {
    public BulkOutputConfig {
      name = Strings.requireIdentifier("outputs.name", name);
      Objects.requireNonNull(endpoint, "endpoint");
      String scheme = endpoint.getScheme();
      if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
        throw new IllegalArgumentException("outputs." + name + ".url must use http or https: " + endpoint);
      }
      if (endpoint.getHost() == null) {
        throw new IllegalArgumentException("outputs." + name + ".url must name a host: " + endpoint);
      }
      Numbers.requireRange("outputs." + name + ".limit", limit, 1, Integer.MAX_VALUE);
      Numbers.requireRange("outputs." + name + ".intervalMillis", intervalMillis, 1, Long.MAX_VALUE);
      Numbers.requireRange("outputs." + name + ".queueCapacity", queueCapacity, 1, Integer.MAX_VALUE);
    }
  }

  /**
   * Output discarding every record.
   *
   * @param name output name
   * @param queueCapacity channel capacity
   */
  record NullOutputConfig(String name, int queueCapacity) implements OutputConfig {
    public NullOutputConfig {
      name = Strings.requireIdentifier("outputs.name", name);
      Numbers.requireRange("outputs." + name + ".queueCapacity", queueCapacity, 1, Integer.MAX_VALUE);
    }
  }
}
