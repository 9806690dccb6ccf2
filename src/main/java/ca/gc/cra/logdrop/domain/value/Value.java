package ca.gc.cra.logdrop.domain.value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Structured data tree carried by every decoded log record.
 * <p><strong>Why:</strong> Gives parsers, templates, and sinks one closed vocabulary of values instead of
 * loosely typed {@code Map}/{@code List} graphs.</p>
 * <p><strong>Role:</strong> Domain value type produced by {@code ValueBuilder} and consumed by outputs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Represent null, boolean, number, string, array, and object nodes.</li>
 *   <li>Offer field lookup on object nodes without exposing mutation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every variant is deeply immutable; instances may be shared freely between
 * outputs, which is how a record is handed to several sinks without any sink observing another's changes.</p>
 * <p><strong>Performance:</strong> Containers copy their contents once at construction.</p>
 *
 * @since 0.1.0
 * @see LogRecord
 */
public sealed interface Value
    permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

  /**
   * Looks up a field when this value is an object.
   *
   * @param name field name
   * @return the field value, or empty when absent or when this value is not an object
   */
  default Optional<Value> find(String name) {
    return Optional.empty();
  }

  /**
   * Indicates whether this value is a container (array or object).
   *
   * @return {@code true} for arrays and objects
   */
  default boolean isContainer() {
    return false;
  }

  /**
   * Returns the shared null value.
   *
   * @return null singleton
   */
  static Value nullValue() {
    return JsonNull.INSTANCE;
  }

  /**
   * Wraps a boolean.
   *
   * @param value boolean to wrap
   * @return boolean value
   */
  static Value of(boolean value) {
    return value ? JsonBoolean.TRUE : JsonBoolean.FALSE;
  }

  /**
   * Wraps a number.
   *
   * @param value number to wrap
   * @return number value
   */
  static Value of(double value) {
    return new JsonNumber(value);
  }

  /**
   * Wraps a string.
   *
   * @param value string to wrap; must not be {@code null}
   * @return string value
   */
  static Value of(String value) {
    return new JsonString(value);
  }

  /**
   * Builds an array from the supplied elements.
   *
   * @param elements elements in order
   * @return array value
   */
  static Value array(List<Value> elements) {
    return new JsonArray(elements);
  }

  /**
   * Builds an object from the supplied fields.
   *
   * @param fields field map
   * @return object value
   */
  static Value object(Map<String, Value> fields) {
    return new JsonObject(fields);
  }
}
