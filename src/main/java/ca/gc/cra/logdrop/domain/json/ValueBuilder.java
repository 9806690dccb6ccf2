package ca.gc.cra.logdrop.domain.json;

import ca.gc.cra.logdrop.domain.value.Value;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <strong>What:</strong> Assembles complete {@link Value} trees from a {@link JsonStreamParser}.
 * <p><strong>Why:</strong> Codecs want whole documents, not events.</p>
 * <p><strong>Role:</strong> Domain adapter between the event parser and record decoding.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Yield one value per top-level document, in stream order.</li>
 *   <li>Raise {@link JsonParseException} on the first parser error, then report exhaustion.</li>
 *   <li>Hold partially built containers on an explicit stack; nesting depth never grows the call stack.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p>Both {@link #hasNext()} and {@link #next()} may pull from the parser and therefore may throw
 * {@link JsonParseException}. Duplicate object keys keep the last value.</p>
 *
 * @since 0.1.0
 */
public final class ValueBuilder implements Iterator<Value> {
  private final JsonStreamParser parser;
  private final Deque<Frame> frames = new ArrayDeque<>();
  private Value pending;
  private boolean finished;

  /**
   * Creates a builder over an existing parser.
   *
   * @param parser event source; must not be {@code null}
   */
  public ValueBuilder(JsonStreamParser parser) {
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * Creates a builder reading from the supplied characters.
   *
   * @param reader character source; must not be {@code null}
   * @return builder over a fresh parser
   */
  public static ValueBuilder over(Reader reader) {
    return new ValueBuilder(new JsonStreamParser(reader));
  }

  @Override
  public boolean hasNext() {
    if (pending != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    pending = build();
    return pending != null;
  }

  @Override
  public Value next() {
    if (!hasNext()) {
      throw new NoSuchElementException("no more values");
    }
    Value value = pending;
    pending = null;
    return value;
  }

  private Value build() {
    while (true) {
      JsonEvent event = parser.next().orElse(null);
      if (event == null) {
        finished = true;
        return null;
      }
      if (event instanceof JsonEvent.Error error) {
        finished = true;
        frames.clear();
        throw new JsonParseException(error.error());
      }

      Value completed;
      if (event instanceof JsonEvent.ArrayBegin) {
        frames.push(new ArrayFrame());
        continue;
      } else if (event instanceof JsonEvent.ObjectBegin) {
        frames.push(new ObjectFrame());
        continue;
      } else if (event instanceof JsonEvent.ArrayEnd || event instanceof JsonEvent.ObjectEnd) {
        completed = frames.pop().build();
      } else if (event instanceof JsonEvent.StringValue string
          && frames.peek() instanceof ObjectFrame object
          && object.awaitingKey()) {
        object.key(string.value());
        continue;
      } else {
        completed = scalar(event);
      }

      Frame parent = frames.peek();
      if (parent == null) {
        return completed;
      }
      parent.accept(completed);
    }
  }

  private static Value scalar(JsonEvent event) {
    if (event instanceof JsonEvent.NullValue) {
      return Value.nullValue();
    } else if (event instanceof JsonEvent.BooleanValue bool) {
      return Value.of(bool.value());
    } else if (event instanceof JsonEvent.NumberValue number) {
      return Value.of(number.value());
    } else if (event instanceof JsonEvent.StringValue string) {
      return Value.of(string.value());
    }
    throw new IllegalStateException("Unexpected event " + event);
  }

  private abstract static class Frame {
    abstract void accept(Value value);

    abstract Value build();
  }

  private static final class ArrayFrame extends Frame {
    private final List<Value> elements = new ArrayList<>();

    @Override
    void accept(Value value) {
      elements.add(value);
    }

    @Override
    Value build() {
      return Value.array(elements);
    }
  }

  private static final class ObjectFrame extends Frame {
    private final Map<String, Value> fields = new LinkedHashMap<>();
    private String key;

    boolean awaitingKey() {
      return key == null;
    }

    void key(String name) {
      key = name;
    }

    @Override
    void accept(Value value) {
      fields.put(key, value);
      key = null;
    }

    @Override
    Value build() {
      return Value.object(fields);
    }
  }
}
