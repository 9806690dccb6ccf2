package ca.gc.cra.logdrop.application.pipeline;

import java.util.Objects;

/**
 * Tuning for {@link RecordDispatcher}.
 *
 * @param requiredField top-level field a record must carry to be routed
 * @param ingestCapacity capacity of the shared ingestion channel
 * @since 0.1.0
 */
public record DispatcherSettings(String requiredField, int ingestCapacity) {
  public static final String DEFAULT_REQUIRED_FIELD = "message";
  public static final int DEFAULT_INGEST_CAPACITY = 4096;

  public DispatcherSettings {
    Objects.requireNonNull(requiredField, "requiredField");
    if (requiredField.isBlank()) {
      throw new IllegalArgumentException("requiredField must not be blank");
    }
    if (ingestCapacity <= 0) {
      throw new IllegalArgumentException("ingestCapacity must be positive");
    }
  }

  /**
   * Returns the stock settings: field {@code message}, 4096 ingest slots.
   *
   * @return default settings
   */
  public static DispatcherSettings defaults() {
    return new DispatcherSettings(DEFAULT_REQUIRED_FIELD, DEFAULT_INGEST_CAPACITY);
  }
}
