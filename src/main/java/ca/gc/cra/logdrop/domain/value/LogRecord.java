package ca.gc.cra.logdrop.domain.value;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Object-shaped log record moving through the router pipeline.
 * <p><strong>Why:</strong> Inputs may decode arbitrary values; only objects are routable because outputs address
 * fields by name.</p>
 * <p><strong>Role:</strong> Domain envelope passed from inputs to the dispatcher and from the dispatcher to outputs.</p>
 * <p><strong>Thread-safety:</strong> Immutable. {@link #copy()} yields a fresh envelope per output over the same
 * immutable tree.</p>
 *
 * @since 0.1.0
 */
public final class LogRecord {
  private final JsonObject body;

  private LogRecord(JsonObject body) {
    this.body = body;
  }

  /**
   * Wraps an object value.
   *
   * @param value decoded value; must be a {@link JsonObject}
   * @return record over {@code value}
   * @throws IllegalArgumentException if {@code value} is not an object
   */
  public static LogRecord of(Value value) {
    Objects.requireNonNull(value, "value");
    if (!(value instanceof JsonObject object)) {
      throw new IllegalArgumentException("record must be an object (was " + value.getClass().getSimpleName() + ")");
    }
    return new LogRecord(object);
  }

  /**
   * Builds a record from a field map.
   *
   * @param fields top-level fields
   * @return record
   */
  public static LogRecord of(Map<String, Value> fields) {
    return new LogRecord(new JsonObject(fields));
  }

  /**
   * Looks up a top-level field.
   *
   * @param name field name
   * @return field value when present
   */
  public Optional<Value> find(String name) {
    return body.find(name);
  }

  /**
   * Returns the record body.
   *
   * @return object body
   */
  public JsonObject body() {
    return body;
  }

  /**
   * Returns an independent envelope over the same immutable body.
   *
   * @return new record instance
   */
  public LogRecord copy() {
    return new LogRecord(body);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof LogRecord that && body.equals(that.body);
  }

  @Override
  public int hashCode() {
    return body.hashCode();
  }

  @Override
  public String toString() {
    return "LogRecord" + body.fields();
  }
}
