package ca.gc.cra.logdrop.infrastructure.input.codec;

import ca.gc.cra.logdrop.domain.json.JsonParseException;
import ca.gc.cra.logdrop.domain.json.ValueBuilder;
import ca.gc.cra.logdrop.domain.value.JsonObject;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;
import ca.gc.cra.logdrop.logging.Logs;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes concatenated UTF-8 JSON documents into records.
 *
 * <p>Non-object documents are skipped with a warning. A syntax error ends the sequence for that stream only.</p>
 *
 * @since 0.1.0
 */
public final class JsonStreamCodec implements RecordCodec {
  private static final Logger log = LoggerFactory.getLogger(JsonStreamCodec.class);

  @Override
  public Iterator<LogRecord> decode(InputStream in) {
    Objects.requireNonNull(in, "in");
    ValueBuilder values =
        ValueBuilder.over(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    return new RecordIterator(values);
  }

  private static final class RecordIterator implements Iterator<LogRecord> {
    private final ValueBuilder values;
    private LogRecord pending;
    private boolean done;

    RecordIterator(ValueBuilder values) {
      this.values = values;
    }

    @Override
    public boolean hasNext() {
      while (pending == null && !done) {
        try {
          if (!values.hasNext()) {
            done = true;
            break;
          }
          Value value = values.next();
          if (value instanceof JsonObject) {
            pending = LogRecord.of(value);
          } else {
            log.warn("Skipping non-object document: {}", Logs.dump(value));
          }
        } catch (JsonParseException ex) {
          done = true;
          log.warn("Closing JSON stream after parse error: {}", ex.getMessage());
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
  }
}
