package ca.gc.cra.logdrop.application.port;

import ca.gc.cra.logdrop.domain.value.LogRecord;

/**
 * <strong>What:</strong> Port for sinks that consume dispatched log records.
 * <p><strong>Why:</strong> Lets the dispatcher fan records out to files, bulk indexers, or nowhere without knowing
 * how each sink stores them.</p>
 * <p><strong>Role:</strong> Output port on the sink side of the router.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept records in dispatch order.</li>
 *   <li>Absorb per-record failures (missing fields, I/O) by logging and dropping.</li>
 *   <li>Release handles, threads, and connections on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The dispatcher calls {@link #feed(LogRecord)} from a single worker thread per
 * output; implementations need not be thread-safe for {@code feed}.</p>
 * <p><strong>Observability:</strong> Implementations should emit {@code output.<name>.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface OutputPort extends AutoCloseable {
  /**
   * Consumes a single record.
   *
   * @param record record to deliver; never {@code null}
   * @throws Exception if the sink hits an unexpected failure; the dispatcher logs it and keeps feeding
   */
  void feed(LogRecord record) throws Exception;

  /**
   * Releases sink resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
