package ca.gc.cra.logdrop.infrastructure.output.file;

import ca.gc.cra.logdrop.application.port.MetricsPort;
import ca.gc.cra.logdrop.application.port.OutputPort;
import ca.gc.cra.logdrop.domain.template.Template;
import ca.gc.cra.logdrop.domain.template.TemplateResolutionException;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.logging.Logs;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Output that appends one rendered line per record to a file chosen by a path template.
 * <p><strong>Why:</strong> Routing by field ({@code /var/log/{app}/{host}.log}) needs a writer per target file
 * without reopening on every record.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link OutputPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render the path and line templates; drop the record with a warning when a field is missing.</li>
 *   <li>Create parent directories and the file when absent.</li>
 *   <li>Cache append-mode writers by {@link FileIdentity}, so different spellings of one file share a handle and
 *       each file is opened at most once.</li>
 *   <li>Write the line plus {@code \n} and flush; I/O failures are logged and the record dropped.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the dispatcher feeds it from one worker thread.</p>
 * <p><strong>Observability:</strong> Emits {@code output.<name>.written}, {@code output.<name>.dropped.path},
 * {@code output.<name>.dropped.message}, {@code output.<name>.dropped.io}.</p>
 *
 * @since 0.1.0
 */
public final class FileOutputAdapter implements OutputPort {
  private static final Logger log = LoggerFactory.getLogger(FileOutputAdapter.class);

  /** Line format used when an output configures none. */
  public static final String DEFAULT_MESSAGE_FORMAT = "{message}";

  private final String name;
  private final Template pathTemplate;
  private final Template messageTemplate;
  private final MetricsPort metrics;
  private final Map<FileIdentity, BufferedWriter> handles = new HashMap<>();

  /**
   * Creates a file output with the default line format and no metrics.
   *
   * @param pathTemplate template rendering the target path
   */
  public FileOutputAdapter(Template pathTemplate) {
    this("file", pathTemplate, Template.compile(DEFAULT_MESSAGE_FORMAT), MetricsPort.NO_OP);
  }

  /**
   * Creates a file output.
   *
   * @param name output name used in logs and metrics
   * @param pathTemplate template rendering the target path
   * @param messageTemplate template rendering each line
   * @param metrics metrics sink
   */
  public FileOutputAdapter(String name, Template pathTemplate, Template messageTemplate, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.pathTemplate = Objects.requireNonNull(pathTemplate, "pathTemplate");
    this.messageTemplate = Objects.requireNonNull(messageTemplate, "messageTemplate");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void feed(LogRecord record) {
    Path path;
    try {
      path = Path.of(pathTemplate.render(record));
    } catch (TemplateResolutionException | InvalidPathException ex) {
      metrics.increment("output." + name + ".dropped.path");
      log.warn("Output {} cannot resolve path '{}': {}; dropping {}",
          name, pathTemplate, ex.getMessage(), Logs.dump(record));
      return;
    }

    BufferedWriter writer;
    try {
      writer = writerFor(path);
    } catch (IOException ex) {
      metrics.increment("output." + name + ".dropped.io");
      log.warn("Output {} cannot open {}", name, path, ex);
      return;
    }

    String line;
    try {
      line = messageTemplate.render(record);
    } catch (TemplateResolutionException ex) {
      metrics.increment("output." + name + ".dropped.message");
      log.warn("Output {} cannot render line '{}': {}; dropping {}",
          name, messageTemplate, ex.getMessage(), Logs.dump(record));
      return;
    }

    try {
      writer.write(line);
      writer.write('\n');
      writer.flush();
      metrics.increment("output." + name + ".written");
    } catch (IOException ex) {
      metrics.increment("output." + name + ".dropped.io");
      log.warn("Output {} failed to write to {}", name, path, ex);
    }
  }

  private BufferedWriter writerFor(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (Files.notExists(path)) {
      try {
        Files.createFile(path);
      } catch (FileAlreadyExistsException raced) {
        log.debug("File {} appeared before it could be created", path);
      }
    }
    FileIdentity identity = FileIdentity.of(path);
    BufferedWriter writer = handles.get(identity);
    if (writer == null) {
      writer = Files.newBufferedWriter(
          path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
      handles.put(identity, writer);
      log.info("Output {} opened {} ({} open files)", name, path, handles.size());
    }
    return writer;
  }

  /**
   * Returns the number of cached file handles.
   *
   * @return distinct files opened so far
   */
  public int openHandleCount() {
    return handles.size();
  }

  @Override
  public void close() {
    for (Map.Entry<FileIdentity, BufferedWriter> entry : handles.entrySet()) {
      try {
        entry.getValue().close();
      } catch (IOException ex) {
        log.warn("Output {} failed to close file {}", name, entry.getKey().key(), ex);
      }
    }
    handles.clear();
  }
}
