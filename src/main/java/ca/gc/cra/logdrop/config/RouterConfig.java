package ca.gc.cra.logdrop.config;

import ca.gc.cra.logdrop.application.pipeline.DispatcherSettings;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Complete router configuration: dispatcher tuning, inputs, outputs, and an optional root log level.
 *
 * @param dispatcher dispatcher settings
 * @param inputs configured listeners; may be empty
 * @param outputs configured sinks; names are unique
 * @param logLevel root log level override, e.g. {@code DEBUG}
 * @since 0.1.0
 */
public record RouterConfig(
    DispatcherSettings dispatcher,
    List<InputConfig> inputs,
    List<OutputConfig> outputs,
    Optional<String> logLevel) {

  public RouterConfig {
    Objects.requireNonNull(dispatcher, "dispatcher");
    inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
    Objects.requireNonNull(logLevel, "logLevel");
    Set<String> names = new HashSet<>();
    for (OutputConfig output : outputs) {
      if (!names.add(output.name())) {
        throw new IllegalArgumentException("Duplicate output name: " + output.name());
      }
    }
  }
}
