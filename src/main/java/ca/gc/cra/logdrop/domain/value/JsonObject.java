package ca.gc.cra.logdrop.domain.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON object. Field order is kept for rendering but is not part of equality.
 *
 * @param fields field map; copied into an unmodifiable insertion-ordered map
 * @since 0.1.0
 */
public record JsonObject(Map<String, Value> fields) implements Value {
  public JsonObject {
    Objects.requireNonNull(fields, "fields");
    Map<String, Value> copy = new LinkedHashMap<>(fields.size() * 2);
    for (Map.Entry<String, Value> entry : fields.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "field name"),
          Objects.requireNonNull(entry.getValue(), "field value"));
    }
    fields = Collections.unmodifiableMap(copy);
  }

  @Override
  public Optional<Value> find(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  @Override
  public boolean isContainer() {
    return true;
  }
}
