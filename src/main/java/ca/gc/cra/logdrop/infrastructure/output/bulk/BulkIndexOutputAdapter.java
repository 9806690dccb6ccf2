package ca.gc.cra.logdrop.infrastructure.output.bulk;

import ca.gc.cra.logdrop.application.port.BulkTransport;
import ca.gc.cra.logdrop.application.port.MetricsPort;
import ca.gc.cra.logdrop.application.port.OutputPort;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logdrop.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Output batching serialized records into bulk index requests.
 * <p><strong>Why:</strong> One HTTP round trip per record would cap throughput; one per batch keeps indexing cheap
 * while the interval timer bounds how long a quiet stream's records wait.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link OutputPort}; delivery is delegated to a
 * {@link BulkTransport}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge record chunks and timer ticks onto one owner thread ({@code bulk-<name>}) through an event queue.</li>
 *   <li>Flush as soon as the batch reaches {@code limit}, restarting the interval timer.</li>
 *   <li>Flush whatever is queued when the timer ({@code bulk-timer-<name>}) fires; an empty batch sends nothing.</li>
 *   <li>Hand each payload to the transport without waiting for its outcome; failed batches are not retried.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #feed(LogRecord)} may be called from any thread; batch state and the
 * scheduled tick are confined to the owner thread. The timer thread only posts ticks, each tagged with the
 * generation it was scheduled under, so a tick queued before a restart is ignored.</p>
 * <p><strong>Observability:</strong> Emits {@code output.<name>.bulk.flushed}, {@code output.<name>.bulk.batchSize},
 * and {@code output.<name>.dropped.serialize}.</p>
 *
 * @since 0.1.0
 */
public final class BulkIndexOutputAdapter implements OutputPort {
  private static final Logger log = LoggerFactory.getLogger(BulkIndexOutputAdapter.class);

  public static final int DEFAULT_LIMIT = 100;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(3000);

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private final String name;
  private final BulkTransport transport;
  private final int limit;
  private final long intervalNanos;
  private final RecordSerializer serializer;
  private final MetricsPort metrics;
  private final BlockingQueue<BulkEvent> events = new LinkedBlockingQueue<>();
  private final List<String> batch;
  private final AtomicBoolean closed = new AtomicBoolean();

  private final ExecutorService owner;
  private final ScheduledExecutorService timer;
  private ScheduledFuture<?> tick;
  private long generation;

  /**
   * Creates a bulk output with default limit and interval.
   *
   * @param name output name used for threads, logs, and metrics
   * @param transport payload delivery
   */
  public BulkIndexOutputAdapter(String name, BulkTransport transport) {
    this(name, transport, DEFAULT_LIMIT, DEFAULT_FLUSH_INTERVAL, new RecordSerializer(), MetricsPort.NO_OP);
  }

  /**
   * Creates a bulk output and starts its owner and timer threads.
   *
   * @param name output name used for threads, logs, and metrics
   * @param transport payload delivery
   * @param limit batch size that triggers an immediate flush; must be positive
   * @param flushInterval maximum wait before a partial batch is flushed; must be positive
   * @param serializer record renderer
   * @param metrics metrics sink
   */
  public BulkIndexOutputAdapter(
      String name,
      BulkTransport transport,
      int limit,
      Duration flushInterval,
      RecordSerializer serializer,
      MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(flushInterval, "flushInterval");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    this.limit = limit;
    this.intervalNanos = flushInterval.toNanos();
    this.batch = new ArrayList<>(limit);

    this.owner = ExecutorFactories.newSingleWorker(
        "bulk-" + name, (thread, ex) -> log.error("Bulk output {} owner crashed", name, ex));
    this.timer = ExecutorFactories.newScheduledWorker(
        "bulk-timer-" + name, (thread, ex) -> log.error("Bulk output {} timer crashed", name, ex));
    restartTimer();
    owner.execute(this::runOwner);
    log.info("Bulk output {} started (limit {}, interval {} ms)", name, limit, flushInterval.toMillis());
  }

  /**
   * Serializes the record and queues it for the owner thread.
   *
   * @param record record to index
   * @throws InterruptedException if interrupted while queueing
   */
  @Override
  public void feed(LogRecord record) throws InterruptedException {
    if (closed.get()) {
      throw new IllegalStateException("Bulk output " + name + " is closed");
    }
    String document;
    try {
      document = serializer.serialize(record);
    } catch (IOException ex) {
      metrics.increment("output." + name + ".dropped.serialize");
      log.warn("Bulk output {} cannot serialize {}: {}", name, Logs.dump(record), ex.getMessage());
      return;
    }
    events.put(new BulkEvent.Chunk(document));
  }

  private void runOwner() {
    MDC.put("pipeline", "bulk-" + name);
    try {
      while (!Thread.currentThread().isInterrupted()) {
        BulkEvent event = events.take();
        if (event instanceof BulkEvent.Chunk chunk) {
          batch.add(chunk.document());
          if (batch.size() >= limit) {
            flush("limit");
            restartTimer();
          }
        } else if (event instanceof BulkEvent.Timeout timeout && timeout.generation() == generation) {
          flush("interval");
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      if (!batch.isEmpty()) {
        log.debug("Bulk output {} stopped with {} unsent documents", name, batch.size());
      }
      MDC.remove("pipeline");
    }
  }

  private void flush(String trigger) {
    if (batch.isEmpty()) {
      return;
    }
    int size = batch.size();
    String payload = BulkPayload.of(batch);
    batch.clear();
    metrics.increment("output." + name + ".bulk.flushed");
    metrics.observe("output." + name + ".bulk.batchSize", size);
    log.debug("Bulk output {} flushing {} documents ({})", name, size, trigger);
    try {
      transport.send(payload);
    } catch (RuntimeException ex) {
      log.warn("Bulk output {} dropped a batch of {} documents", name, size, ex);
    }
  }

  private void restartTimer() {
    if (tick != null) {
      tick.cancel(false);
    }
    long current = ++generation;
    try {
      tick = timer.scheduleAtFixedRate(
          () -> events.offer(new BulkEvent.Timeout(current)), intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException closing) {
      log.debug("Bulk output {} timer already stopped", name);
    }
  }

  /** Stops both threads without flushing the pending batch, then closes the transport. */
  @Override
  public void close() throws Exception {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    timer.shutdownNow();
    owner.shutdownNow();
    boolean stopped = timer.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
        & owner.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    if (!stopped) {
      log.warn("Bulk output {} threads still running after {} ms", name, SHUTDOWN_TIMEOUT.toMillis());
    }
    transport.close();
  }

  /** Work item for the owner thread. */
  private sealed interface BulkEvent {
    record Chunk(String document) implements BulkEvent {}

    record Timeout(long generation) implements BulkEvent {}
  }
}
