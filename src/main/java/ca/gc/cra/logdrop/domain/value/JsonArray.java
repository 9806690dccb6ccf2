package ca.gc.cra.logdrop.domain.value;

import java.util.List;
import java.util.Objects;

/**
 * Ordered JSON array.
 *
 * @param elements elements in document order; copied into an unmodifiable list
 * @since 0.1.0
 */
public record JsonArray(List<Value> elements) implements Value {
  public JsonArray {
    elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
  }

  @Override
  public boolean isContainer() {
    return true;
  }

  /**
   * Returns the number of elements.
   *
   * @return element count
   */
  public int size() {
    return elements.size();
  }
}
