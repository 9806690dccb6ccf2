package ca.gc.cra.logdrop.domain.value;

/**
 * JSON {@code true} or {@code false}.
 *
 * @param value wrapped boolean
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements Value {
  static final JsonBoolean TRUE = new JsonBoolean(true);
  static final JsonBoolean FALSE = new JsonBoolean(false);

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
