package ca.gc.cra.logdrop.application.port;

import ca.gc.cra.logdrop.domain.value.LogRecord;
import java.util.concurrent.BlockingQueue;

/**
 * Port for sources that decode records and place them on the ingestion channel.
 *
 * @since 0.1.0
 */
public interface InputPort extends AutoCloseable {
  /**
   * Runs the input until it is closed or the calling thread is interrupted.
   *
   * @param sink shared ingestion channel; implementations block when it is full
   * @throws Exception if the input cannot start
   */
  void run(BlockingQueue<LogRecord> sink) throws Exception;

  /**
   * Stops accepting input and releases sockets.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
