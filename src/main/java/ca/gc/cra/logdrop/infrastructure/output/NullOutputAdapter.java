package ca.gc.cra.logdrop.infrastructure.output;

import ca.gc.cra.logdrop.application.port.OutputPort;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import java.util.concurrent.atomic.LongAdder;

/**
 * Output that counts and discards every record. Useful for load tests and for silencing a route.
 *
 * @since 0.1.0
 */
public final class NullOutputAdapter implements OutputPort {
  private final LongAdder discarded = new LongAdder();

  @Override
  public void feed(LogRecord record) {
    discarded.increment();
  }

  /**
   * Returns how many records were discarded.
   *
   * @return discard count
   */
  public long discardedCount() {
    return discarded.sum();
  }
}
