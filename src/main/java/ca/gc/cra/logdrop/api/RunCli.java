package ca.gc.cra.logdrop.api;

import ca.gc.cra.logdrop.config.CompositionRoot;
import ca.gc.cra.logdrop.config.RouterConfig;
import ca.gc.cra.logdrop.config.YamlConfigLoader;
import ca.gc.cra.logdrop.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logdrop.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the router described by a YAML configuration until the JVM is asked to stop.
 *
 * @since 0.1.0
 */
final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: logdrop run config=<path.yaml> [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      logdrop run: route structured log records from inputs to outputs

      Usage:
        logdrop run config=<path.yaml> [options]

      Required:
        config=PATH               YAML router configuration

      Optional:
        --dry-run                 Validate the configuration and print the wiring without starting
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when metricsExporter=otlp
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;
  private static final Set<String> KEYS =
      Set.of("config", TelemetryConfigurator.EXPORTER_KEY, TelemetryConfigurator.ENDPOINT_KEY);
  private static final Set<String> FLAGS = Set.of("--dry-run");

  private RunCli() {}

  /**
   * Parses arguments, loads configuration, and runs until a shutdown hook fires.
   *
   * @param input parsed arguments (command already consumed)
   * @return exit code
   */
  static ExitCode run(CliInput input) {
    return run(input, null);
  }

  /**
   * Variant used by tests: when {@code stopSignal} is non-null the router stops once it counts down instead of
   * waiting for JVM shutdown.
   */
  static ExitCode run(CliInput input, CountDownLatch stopSignal) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> kv;
    try {
      List<String> unknown = input.unknownFlags(FLAGS);
      if (!unknown.isEmpty()) {
        throw new IllegalArgumentException("unknown flag: " + unknown.get(0));
      }
      kv = CliArgsParser.toMap(input.keyValueArgs(), KEYS);
      if (!kv.containsKey("config")) {
        throw new IllegalArgumentException("config=<path> is required");
      }
      TelemetryConfigurator.configureMetrics(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RouterConfig config;
    try {
      config = YamlConfigLoader.load(Path.of(kv.get("config")));
      if (config.logLevel().isPresent() && !input.verbose()) {
        LoggingConfigurator.applyRootLevel(config.logLevel().get());
      }
    } catch (InvalidPathException ex) {
      log.error("Invalid config path: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Cannot read configuration {}: {}", kv.get("config"), ex.toString());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration {}: {}", kv.get("config"), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      List<String> lines = new ArrayList<>();
      lines.add("Dry-run: configuration " + kv.get("config") + " is valid; nothing was started.");
      lines.addAll(CompositionRoot.plan(config));
      CliPrinter.printLines(lines);
      return ExitCode.SUCCESS;
    }

    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    CompositionRoot root;
    try {
      root = new CompositionRoot(config, metrics);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration {}: {}", kv.get("config"), ex.getMessage());
      metrics.close();
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Failed to build router", ex);
      metrics.close();
      return ExitCode.RUNTIME_FAILURE;
    }

    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      root.close();
      metrics.close();
      stopped.countDown();
    }, "logdrop-shutdown");
    try {
      root.start();
      log.info("logdrop running with configuration {}", kv.get("config"));
      if (stopSignal == null) {
        Runtime.getRuntime().addShutdownHook(hook);
        stopped.await();
      } else {
        stopSignal.await();
        hook.run();
      }
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while running; shutting down");
      hook.run();
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in router", ex);
      hook.run();
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
