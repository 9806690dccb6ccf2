package ca.gc.cra.logdrop.config;

import ca.gc.cra.logdrop.application.pipeline.OutputBinding;
import ca.gc.cra.logdrop.application.pipeline.RecordDispatcher;
import ca.gc.cra.logdrop.application.port.InputPort;
import ca.gc.cra.logdrop.application.port.MetricsPort;
import ca.gc.cra.logdrop.application.port.OutputPort;
import ca.gc.cra.logdrop.config.OutputConfig.BulkOutputConfig;
import ca.gc.cra.logdrop.config.OutputConfig.FileOutputConfig;
import ca.gc.cra.logdrop.domain.template.Template;
import ca.gc.cra.logdrop.infrastructure.input.codec.JsonStreamCodec;
import ca.gc.cra.logdrop.infrastructure.input.codec.MessagePackCodec;
import ca.gc.cra.logdrop.infrastructure.input.codec.RecordCodec;
import ca.gc.cra.logdrop.infrastructure.input.tcp.TcpInputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.NullOutputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.bulk.BulkIndexOutputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.bulk.JettyBulkTransport;
import ca.gc.cra.logdrop.infrastructure.output.bulk.RecordSerializer;
import ca.gc.cra.logdrop.infrastructure.output.file.FileOutputAdapter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a {@link RouterConfig} into a running router.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI and tests share the same wiring.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning inputs, dispatcher, and outputs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compile output templates and build one {@link OutputPort} per configured output.</li>
 *   <li>Bind outputs to a {@link RecordDispatcher} with their channel capacities.</li>
 *   <li>Run every input on its own {@code input-<type>-<n>} thread feeding the dispatcher's ingestion channel.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} may be called from different threads;
 * each runs at most once.</p>
 * <p><strong>Observability:</strong> Logs the wiring at INFO and input crashes at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RouterConfig config;
  private final MetricsPort metrics;
  private final RecordDispatcher dispatcher;
  private final List<InputPort> inputs;
  private final List<Thread> inputThreads = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Builds outputs, dispatcher, and inputs. Nothing runs until {@link #start()}.
   *
   * @param config validated router configuration
   * @param metrics metrics sink shared by every component
   * @throws IllegalArgumentException if an output template does not compile
   */
  public CompositionRoot(RouterConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    List<OutputBinding> bindings = buildOutputs();
    this.dispatcher = new RecordDispatcher(bindings, metrics, config.dispatcher());
    List<InputPort> built = new ArrayList<>(config.inputs().size());
    for (InputConfig input : config.inputs()) {
      Supplier<RecordCodec> codec =
          InputConfig.CODEC_MSGPACK.equals(input.codec()) ? MessagePackCodec::new : JsonStreamCodec::new;
      built.add(new TcpInputAdapter(input.host(), input.port(), codec, metrics));
    }
    this.inputs = List.copyOf(built);
  }

  private List<OutputBinding> buildOutputs() {
    List<OutputBinding> bindings = new ArrayList<>(config.outputs().size());
    try {
      for (OutputConfig output : config.outputs()) {
        bindings.add(new OutputBinding(output.name(), buildOutput(output), output.queueCapacity()));
      }
    } catch (RuntimeException ex) {
      for (OutputBinding binding : bindings) {
        closeQuietly(binding.name(), binding.port());
      }
      throw ex;
    }
    return bindings;
  }

  private OutputPort buildOutput(OutputConfig output) {
    if (output instanceof FileOutputConfig file) {
      return new FileOutputAdapter(
          file.name(), Template.compile(file.path()), Template.compile(file.format()), metrics);
    }
    if (output instanceof BulkOutputConfig bulk) {
      return new BulkIndexOutputAdapter(
          bulk.name(),
          new JettyBulkTransport(bulk.endpoint()),
          bulk.limit(),
          Duration.ofMillis(bulk.intervalMillis()),
          new RecordSerializer(),
          metrics);
    }
    return new NullOutputAdapter();
  }

  /**
   * Starts the dispatcher and then every input.
   *
   * @throws IllegalStateException if already started or closed
   */
  public void start() {
    if (closed.get() || !started.compareAndSet(false, true)) {
      throw new IllegalStateException("Router already started or closed");
    }
    dispatcher.start();
    for (int i = 0; i < inputs.size(); i++) {
      InputPort input = inputs.get(i);
      String threadName = "input-" + config.inputs().get(i).type() + "-" + i;
      Thread thread = new Thread(() -> runInput(input, threadName), threadName);
      thread.setDaemon(true);
      inputThreads.add(thread);
      thread.start();
    }
    log.info("Router started with {} inputs and {} outputs", inputs.size(), config.outputs().size());
  }

  private void runInput(InputPort input, String threadName) {
    try {
      input.run(dispatcher.ingress());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      log.error("Input {} stopped unexpectedly", threadName, ex);
    }
  }

  /**
   * Describes the wiring a configuration produces without building anything, one line per component.
   *
   * @param config router configuration
   * @return human-readable plan
   */
  public static List<String> plan(RouterConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("dispatcher requiredField=" + config.dispatcher().requiredField()
        + " ingestCapacity=" + config.dispatcher().ingestCapacity());
    for (InputConfig input : config.inputs()) {
      lines.add("input " + input.type() + " " + input.host() + ":" + input.port() + " codec=" + input.codec());
    }
    for (OutputConfig output : config.outputs()) {
      lines.add("output " + output.name() + " " + describe(output) + " queueCapacity=" + output.queueCapacity());
    }
    return lines;
  }

  private static String describe(OutputConfig output) {
    if (output instanceof FileOutputConfig file) {
      return "file path=" + file.path() + " format=" + file.format();
    }
    if (output instanceof BulkOutputConfig bulk) {
      return "bulk url=" + bulk.endpoint() + " limit=" + bulk.limit() + " intervalMillis=" + bulk.intervalMillis();
    }
    return "null";
  }

  /**
   * Returns the dispatcher for diagnostics.
   *
   * @return dispatcher
   */
  public RecordDispatcher dispatcher() {
    return dispatcher;
  }

  List<InputPort> inputs() {
    return inputs;
  }

  /** Stops inputs first, then the dispatcher and its outputs. Queued records are not drained. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (int i = 0; i < inputs.size(); i++) {
      closeQuietly("input-" + i, inputs.get(i));
    }
    for (Thread thread : inputThreads) {
      thread.interrupt();
    }
    dispatcher.close();
    log.info("Router stopped");
  }

  private static void closeQuietly(String name, AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.warn("Failed to close {}", name, ex);
    }
  }
}
