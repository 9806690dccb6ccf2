package ca.gc.cra.logdrop.application.pipeline;

import ca.gc.cra.logdrop.application.port.MetricsPort;
import ca.gc.cra.logdrop.application.port.OutputPort;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logdrop.logging.Logs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Routes records from the shared ingestion channel to every configured output.
 * <p>One {@code dispatcher} thread takes records, drops those lacking the required field, and offers a copy to
 * each output's private bounded channel without waiting. Every output is drained by its own {@code output-<name>}
 * thread; while a stalled sink's channel is full, records are dropped for that output alone and the others keep
 * receiving them in acceptance order.</p>
 * <p>Instances are not reusable; {@link #start()} at most once. {@link #close()} interrupts all threads without
 * draining queued records and then closes the outputs.</p>
 *
 * @since 0.1.0
 */
public final class RecordDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordDispatcher.class);

  private static final int DROP_LOG_INTERVAL = 1_000;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private final DispatcherSettings settings;
  private final MetricsPort metrics;
  private final BlockingQueue<LogRecord> ingress;
  private final List<OutputChannel> channels;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final LongAdder accepted = new LongAdder();
  private final LongAdder droppedMissingField = new LongAdder();

  private volatile ExecutorService dispatcherExecutor;

  /**
   * Creates a dispatcher with default settings.
   *
   * @param outputs outputs to fan out to; names must be unique
   * @param metrics metrics sink
   */
  public RecordDispatcher(List<OutputBinding> outputs, MetricsPort metrics) {
    this(outputs, metrics, DispatcherSettings.defaults());
  }

  /**
   * Creates a dispatcher.
   *
   * @param outputs outputs to fan out to; names must be unique
   * @param metrics metrics sink
   * @param settings required field and ingestion capacity
   */
  public RecordDispatcher(List<OutputBinding> outputs, MetricsPort metrics, DispatcherSettings settings) {
    Objects.requireNonNull(outputs, "outputs");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.ingress = new ArrayBlockingQueue<>(settings.ingestCapacity());

    Set<String> names = new HashSet<>();
    List<OutputChannel> built = new ArrayList<>(outputs.size());
    for (OutputBinding binding : outputs) {
      if (!names.add(binding.name())) {
        throw new IllegalArgumentException("Duplicate output name: " + binding.name());
      }
      built.add(new OutputChannel(binding));
    }
    this.channels = List.copyOf(built);
  }

  /**
   * Returns the shared ingestion channel that inputs {@code put} decoded records on.
   *
   * @return ingestion queue
   */
  public BlockingQueue<LogRecord> ingress() {
    return ingress;
  }

  /** Starts the output workers and the dispatcher loop. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Dispatcher already started");
    }
    for (OutputChannel channel : channels) {
      channel.start();
    }
    ExecutorService executor =
        ExecutorFactories.newSingleWorker(
            "dispatcher", (thread, ex) -> log.error("Dispatcher loop crashed", ex));
    dispatcherExecutor = executor;
    executor.execute(this::runLoop);
    log.info(
        "Dispatcher started with {} outputs {}, required field '{}'",
        channels.size(),
        outputNames(),
        settings.requiredField());
  }

  private void runLoop() {
    MDC.put("pipeline", "dispatcher");
    try {
      while (!Thread.currentThread().isInterrupted()) {
        LogRecord record = ingress.take();
        dispatch(record);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      log.debug("Dispatcher loop stopped after {} accepted records", accepted.sum());
      MDC.remove("pipeline");
    }
  }

  /**
   * Validates one record and offers it to every output.
   *
   * @param record record taken from ingestion
   * @return {@code true} if the record was accepted, {@code false} if it lacked the required field
   */
  public boolean dispatch(LogRecord record) {
    Objects.requireNonNull(record, "record");
    if (record.find(settings.requiredField()).isEmpty()) {
      droppedMissingField.increment();
      metrics.increment("dispatcher.record.dropped.missingField");
      log.warn("Dropping record without required field '{}': {}", settings.requiredField(), Logs.dump(record));
      return false;
    }
    accepted.increment();
    metrics.increment("dispatcher.record.accepted");
    for (OutputChannel channel : channels) {
      channel.offer(record.copy());
    }
    return true;
  }

  /**
   * Returns how many records were accepted.
   *
   * @return accepted count
   */
  public long acceptedCount() {
    return accepted.sum();
  }

  /**
   * Returns how many records were dropped for lacking the required field.
   *
   * @return drop count
   */
  public long droppedMissingFieldCount() {
    return droppedMissingField.sum();
  }

  /**
   * Returns how many records an output lost to a full channel.
   *
   * @param outputName configured output name
   * @return drop count
   * @throws IllegalArgumentException if no output has that name
   */
  public long droppedFullCount(String outputName) {
    return channel(outputName).droppedFull.sum();
  }

  /**
   * Returns how many records an output consumed without throwing.
   *
   * @param outputName configured output name
   * @return delivery count
   * @throws IllegalArgumentException if no output has that name
   */
  public long deliveredCount(String outputName) {
    return channel(outputName).delivered.sum();
  }

  /** Interrupts the dispatcher and output threads, then closes every output. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    ExecutorService executor = dispatcherExecutor;
    if (executor != null) {
      executor.shutdownNow();
    }
    for (OutputChannel channel : channels) {
      channel.stop();
    }
    awaitQuietly(executor, "dispatcher");
    for (OutputChannel channel : channels) {
      awaitQuietly(channel.worker, "output-" + channel.name);
    }
    for (OutputChannel channel : channels) {
      try {
        channel.port.close();
        log.info("Output {} closed", channel.name);
      } catch (Exception ex) {
        log.error("Failed to close output {}", channel.name, ex);
      }
    }
    dispatcherExecutor = null;
  }

  private static void awaitQuietly(ExecutorService executor, String name) {
    if (executor == null) {
      return;
    }
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Thread {} still running {} ms after interrupt", name, SHUTDOWN_TIMEOUT.toMillis());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private OutputChannel channel(String outputName) {
    for (OutputChannel channel : channels) {
      if (channel.name.equals(outputName)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("Unknown output: " + outputName);
  }

  private List<String> outputNames() {
    List<String> names = new ArrayList<>(channels.size());
    for (OutputChannel channel : channels) {
      names.add(channel.name);
    }
    return names;
  }

  private final class OutputChannel {
    private final String name;
    private final OutputPort port;
    private final BlockingQueue<LogRecord> queue;
    private final String droppedFullMetric;
    private final String failedMetric;
    private final LongAdder droppedFull = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private volatile ExecutorService worker;

    OutputChannel(OutputBinding binding) {
      this.name = binding.name();
      this.port = binding.port();
      this.queue = new ArrayBlockingQueue<>(binding.queueCapacity());
      this.droppedFullMetric = "output." + name + ".dropped.full";
      this.failedMetric = "output." + name + ".failed";
    }

    void start() {
      ExecutorService executor =
          ExecutorFactories.newSingleWorker(
              "output-" + name, (thread, ex) -> log.error("Output {} worker crashed", name, ex));
      worker = executor;
      executor.execute(this::drain);
    }

    void stop() {
      ExecutorService executor = worker;
      if (executor != null) {
        executor.shutdownNow();
      }
    }

    void offer(LogRecord record) {
      if (queue.offer(record)) {
        return;
      }
      droppedFull.increment();
      metrics.increment(droppedFullMetric);
      long drops = droppedFull.sum();
      if (drops == 1 || drops % DROP_LOG_INTERVAL == 0) {
        log.warn(
            "Output {} channel full ({} slots); dropped {} records for this output so far",
            name,
            queue.remainingCapacity() + queue.size(),
            drops);
      }
    }

    private void drain() {
      MDC.put("pipeline", "output-" + name);
      try {
        while (!Thread.currentThread().isInterrupted()) {
          deliver(queue.take());
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      } finally {
        MDC.remove("pipeline");
      }
    }

    private void deliver(LogRecord record) {
      try {
        port.feed(record);
        delivered.increment();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      } catch (Exception ex) {
        metrics.increment(failedMetric);
        log.warn("Output {} failed to process record {}", name, Logs.dump(record), ex);
      }
    }
  }
}
