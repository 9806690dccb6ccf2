package ca.gc.cra.logdrop.domain.value;

import java.util.Objects;

/**
 * JSON string.
 *
 * @param value raw string contents (unescaped); never {@code null}
 * @since 0.1.0
 */
public record JsonString(String value) implements Value {
  public JsonString {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return value;
  }
}
