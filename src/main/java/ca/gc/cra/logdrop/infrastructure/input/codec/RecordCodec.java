package ca.gc.cra.logdrop.infrastructure.input.codec;

import ca.gc.cra.logdrop.domain.value.LogRecord;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Decodes a byte stream into records. One codec instance serves one connection.
 *
 * @since 0.1.0
 */
public interface RecordCodec {
  /**
   * Returns a lazy sequence of records read from the stream. The sequence ends when the stream ends or becomes
   * undecodable; it never throws for malformed input.
   *
   * @param in connection input; not closed by the codec
   * @return lazy record sequence
   */
  Iterator<LogRecord> decode(InputStream in);
}
