package ca.gc.cra.logdrop.infrastructure.output.bulk;

import ca.gc.cra.logdrop.domain.value.JsonArray;
import ca.gc.cra.logdrop.domain.value.JsonBoolean;
import ca.gc.cra.logdrop.domain.value.JsonNumber;
import ca.gc.cra.logdrop.domain.value.JsonObject;
import ca.gc.cra.logdrop.domain.value.JsonString;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders records as compact single-line JSON with Jackson's streaming generator.
 *
 * <p>Integral numbers within the exact {@code double} range are written without a fraction. Nesting is walked
 * with an explicit stack. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class RecordSerializer {
  private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d;

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Serializes one record.
   *
   * @param record record to render
   * @return JSON text without line breaks
   * @throws IOException if the generator rejects the value (e.g., nesting beyond its limits)
   */
  public String serialize(LogRecord record) throws IOException {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      write(gen, record.body());
    }
    return out.toString();
  }

  private static void write(JsonGenerator gen, Value root) throws IOException {
    Deque<Frame> frames = new ArrayDeque<>();
    Value next = root;
    while (true) {
      if (next != null) {
        if (next instanceof JsonObject object) {
          gen.writeStartObject();
          frames.push(new Frame(object.fields().entrySet().iterator(), true));
        } else if (next instanceof JsonArray array) {
          gen.writeStartArray();
          frames.push(new Frame(array.elements().iterator(), false));
        } else {
          writeScalar(gen, next);
        }
        next = null;
      }

      Frame top = frames.peek();
      if (top == null) {
        return;
      }
      if (!top.items().hasNext()) {
        frames.pop();
        if (top.object()) {
          gen.writeEndObject();
        } else {
          gen.writeEndArray();
        }
        continue;
      }
      Object item = top.items().next();
      if (item instanceof Map.Entry<?, ?> field) {
        gen.writeFieldName((String) field.getKey());
        next = (Value) field.getValue();
      } else {
        next = (Value) item;
      }
    }
  }

  private static void writeScalar(JsonGenerator gen, Value value) throws IOException {
    if (value instanceof JsonBoolean bool) {
      gen.writeBoolean(bool.value());
    } else if (value instanceof JsonNumber number) {
      double d = number.value();
      if (d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGER) {
        gen.writeNumber((long) d);
      } else {
        gen.writeNumber(d);
      }
    } else if (value instanceof JsonString string) {
      gen.writeString(string.value());
    } else {
      gen.writeNull();
    }
  }

  private record Frame(Iterator<?> items, boolean object) {}
}
