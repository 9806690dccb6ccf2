package ca.gc.cra.logdrop.infrastructure.input.codec;

import ca.gc.cra.logdrop.domain.value.JsonObject;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;
import ca.gc.cra.logdrop.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageTypeException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes a stream of concatenated MessagePack values into records.
 * <p><strong>Why:</strong> Shippers that speak MessagePack avoid the cost of rendering JSON text.</p>
 * <p><strong>Role:</strong> {@link RecordCodec} selected by {@code codec: msgpack}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map nil, booleans, integers, floats, strings, arrays and maps onto {@link Value}; integers become
 *   doubles.</li>
 *   <li>Skip top-level values that are not maps, with a warning.</li>
 *   <li>End the sequence on truncated input, a non-string map key, or a binary or extension value.</li>
 *   <li>Keep partially built containers on an explicit stack so nesting never grows the call stack.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class MessagePackCodec implements RecordCodec {
  private static final Logger log = LoggerFactory.getLogger(MessagePackCodec.class);

  @Override
  public Iterator<LogRecord> decode(InputStream in) {
    Objects.requireNonNull(in, "in");
    return new RecordIterator(MessagePack.newDefaultUnpacker(in));
  }

  private static final class RecordIterator implements Iterator<LogRecord> {
    private final MessageUnpacker unpacker;
    private LogRecord pending;
    private boolean done;

    RecordIterator(MessageUnpacker unpacker) {
      this.unpacker = unpacker;
    }

    @Override
    public boolean hasNext() {
      while (pending == null && !done) {
        try {
          if (!unpacker.hasNext()) {
            done = true;
            break;
          }
          Value value = readValue();
          if (value instanceof JsonObject) {
            pending = LogRecord.of(value);
          } else {
            log.warn("Skipping non-map MessagePack value: {}", Logs.dump(value));
          }
        } catch (IOException | MessagePackException ex) {
          done = true;
          log.warn("Closing MessagePack stream after decode error: {}", ex.getMessage());
        }
      }
      return pending != null;
    }

    @Override
    public LogRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException("no more records");
      }
      LogRecord record = pending;
      pending = null;
      return record;
    }

    private Value readValue() throws IOException {
      Deque<Frame> frames = new ArrayDeque<>();
      while (true) {
        Frame parent = frames.peek();
        ValueType type = unpacker.getNextFormat().getValueType();
        if (parent instanceof MapFrame map && map.awaitingKey()) {
          if (type != ValueType.STRING) {
            throw new MessageTypeException("map key must be a string, got " + type);
          }
          map.key(unpacker.unpackString());
          continue;
        }

        Value completed;
        switch (type) {
          case NIL:
            unpacker.unpackNil();
            completed = Value.nullValue();
            break;
          case BOOLEAN:
            completed = Value.of(unpacker.unpackBoolean());
            break;
          case INTEGER:
            completed = Value.of(unpacker.unpackBigInteger().doubleValue());
            break;
          case FLOAT:
            completed = Value.of(unpacker.unpackDouble());
            break;
          case STRING:
            completed = Value.of(unpacker.unpackString());
            break;
          case ARRAY:
            ArrayFrame array = new ArrayFrame(unpacker.unpackArrayHeader());
            if (!array.complete()) {
              frames.push(array);
              continue;
            }
            completed = array.build();
            break;
          case MAP:
            MapFrame object = new MapFrame(unpacker.unpackMapHeader());
            if (!object.complete()) {
              frames.push(object);
              continue;
            }
            completed = object.build();
            break;
          default:
            throw new MessageTypeException("unsupported MessagePack type " + type);
        }

        // Completing a value may complete every enclosing container in turn.
        while (true) {
          Frame top = frames.peek();
          if (top == null) {
            return completed;
          }
          top.accept(completed);
          if (!top.complete()) {
            break;
          }
          frames.pop();
          completed = top.build();
        }
      }
    }
  }

  private abstract static class Frame {
    abstract void accept(Value value);

    abstract boolean complete();

    abstract Value build();
  }

  private static final class ArrayFrame extends Frame {
    private final int size;
    private final List<Value> elements;

    ArrayFrame(int size) {
      this.size = size;
      this.elements = new ArrayList<>(Math.min(size, 1024));
    }

    @Override
    void accept(Value value) {
      elements.add(value);
    }

    @Override
    boolean complete() {
      return elements.size() == size;
    }

    @Override
    Value build() {
      return Value.array(elements);
    }
  }

  private static final class MapFrame extends Frame {
    private final int size;
    private final Map<String, Value> fields = new LinkedHashMap<>();
    private int entries;
    private String key;

    MapFrame(int size) {
      this.size = size;
    }

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
      entries++;
    }

    @Override
    boolean complete() {
      return entries == size;
    }

    @Override
    Value build() {
      return Value.object(fields);
    }
  }
}
