package ca.gc.cra.logdrop.application.port;

/**
 * Port delivering newline-delimited bulk payloads to a remote index.
 *
 * <p>{@link #send(String)} hands the payload off and returns without waiting for the response. Failures are
 * reported by the implementation's own logging; batches are never retried.</p>
 *
 * @since 0.1.0
 */
public interface BulkTransport extends AutoCloseable {
  /**
   * Starts delivery of one payload.
   *
   * @param payload bulk body; non-empty
   */
  void send(String payload);

  @Override
  default void close() throws Exception {}
}
