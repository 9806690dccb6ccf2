package ca.gc.cra.logdrop.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingConfigReturnsUsageAndInvalidArgs() {
    ExitCode code = run("run");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: logdrop run"));
    assertTrue(logged(Level.ERROR, "config=<path> is required"));
  }

  @Test
  void unknownKeyOrFlagReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("run", "config=a.yaml", "port=1"));
    assertEquals(ExitCode.INVALID_ARGS, run("run", "config=a.yaml", "--fast"));
    assertTrue(logged(Level.ERROR, "unknown flag: --fast"));
  }

  @Test
  void invalidMetricsExporterReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("run", "config=a.yaml", "metricsExporter=prometheus"));
    assertEquals(ExitCode.INVALID_ARGS, run("run", "config=a.yaml", "otelEndpoint=ftp://collector"));
  }

  @Test
  void unreadableConfigReturnsIoError() {
    ExitCode code = run("run", "config=" + tempDir.resolve("missing.yaml"));

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(logged(Level.ERROR, "Cannot read configuration"));
  }

  @Test
  void invalidConfigReturnsConfigError() throws IOException {
    Path config = write("outputs:\n  - type: carrier-pigeon\n");

    ExitCode code = run("run", "config=" + config);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(logged(Level.ERROR, "carrier-pigeon"));
  }

  @Test
  void unknownLogLevelReturnsConfigError() throws IOException {
    Path config = write("logLevel: LOUD\n");

    assertEquals(ExitCode.CONFIG_ERROR, run("run", "config=" + config));
  }

  @Test
  void dryRunPrintsPlanWithoutStarting() throws IOException {
    Path config = write(String.join("\n",
        "inputs:",
        "  - port: 5140",
        "outputs:",
        "  - type: file",
        "    name: archive",
        "    path: " + tempDir.resolve("out") + "/{host}.log",
        ""));

    ExitCode code = run("run", "config=" + config, "--dry-run");

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Dry-run: configuration " + config + " is valid"), out);
    assertTrue(out.contains("input tcp :::5140 codec=json"), out);
    assertTrue(out.contains("output archive file path="), out);
    assertTrue(Files.notExists(tempDir.resolve("out")));
  }

  @Test
  void helpPrintsDetailedUsage() {
    assertEquals(ExitCode.SUCCESS, run("run", "--help"));
    assertTrue(buffer.toString().contains("--dry-run"));
  }

  @Test
  void runsUntilStopped() throws Exception {
    Path config = write(String.join("\n",
        "inputs:",
        "  - host: 127.0.0.1",
        "    port: 0",
        "outputs:",
        "  - type: null",
        ""));
    CountDownLatch stop = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<ExitCode> result = executor.submit(() -> RunCli.run(
          CliInput.parse(new String[] {"run", "config=" + config, "metricsExporter=none"}), stop));
      stop.countDown();

      assertEquals(ExitCode.SUCCESS, result.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
      System.clearProperty("otel.metrics.exporter");
    }
  }

  private ExitCode run(String... args) {
    return RunCli.run(CliInput.parse(args));
  }

  private Path write(String yaml) throws IOException {
    Path config = tempDir.resolve("router.yaml");
    Files.writeString(config, yaml, StandardCharsets.UTF_8);
    return config;
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
