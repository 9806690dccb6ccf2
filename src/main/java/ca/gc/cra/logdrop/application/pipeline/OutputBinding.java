package ca.gc.cra.logdrop.application.pipeline;

import ca.gc.cra.logdrop.application.port.OutputPort;
import java.util.Objects;

/**
 * Named output plus the capacity of its private delivery channel.
 *
 * @param name output name used for thread names and metrics
 * @param port sink receiving records
 * @param queueCapacity capacity of the output's channel
 * @since 0.1.0
 */
public record OutputBinding(String name, OutputPort port, int queueCapacity) {
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;

  public OutputBinding {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(port, "port");
    if (name.isBlank()) {
      throw new IllegalArgumentException("output name must not be blank");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
  }

  public OutputBinding(String name, OutputPort port) {
    this(name, port, DEFAULT_QUEUE_CAPACITY);
  }
}
