package ca.gc.cra.logdrop.infrastructure.output.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ca.gc.cra.logdrop.domain.json.ValueBuilder;
import ca.gc.cra.logdrop.domain.template.Template;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.testutil.RecordingMetrics;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileOutputAdapterTest {
  @TempDir Path tempDir;

  private FileOutputAdapter adapter;

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void writesRenderedLinesToTemplatedPaths() throws IOException {
    RecordingMetrics metrics = new RecordingMetrics();
    adapter = new FileOutputAdapter(
        "files",
        Template.compile(tempDir + "/{id/source}/app.log"),
        Template.compile("[{timestamp}]: {message}"),
        metrics);

    adapter.feed(record("{\"id\":{\"source\":\"db\"},\"timestamp\":1,\"message\":\"first\"}"));
    adapter.feed(record("{\"id\":{\"source\":\"web\"},\"timestamp\":2,\"message\":\"other\"}"));
    adapter.feed(record("{\"id\":{\"source\":\"db\"},\"timestamp\":3,\"message\":\"second\"}"));

    assertEquals(List.of("[1]: first", "[3]: second"), lines(tempDir.resolve("db/app.log")));
    assertEquals(List.of("[2]: other"), lines(tempDir.resolve("web/app.log")));
    assertEquals(2, adapter.openHandleCount());
    assertEquals(3, metrics.counter("output.files.written"));
  }

  @Test
  void defaultFormatWritesMessageField() throws IOException {
    adapter = new FileOutputAdapter(Template.compile(tempDir.resolve("out.log").toString()));

    adapter.feed(record("{\"message\":\"hello\"}"));

    assertEquals(List.of("hello"), lines(tempDir.resolve("out.log")));
  }

  @Test
  void appendsToExistingFile() throws IOException {
    Path target = tempDir.resolve("existing.log");
    Files.writeString(target, "before\n", StandardCharsets.UTF_8);
    adapter = new FileOutputAdapter(Template.compile(target.toString()));

    adapter.feed(record("{\"message\":\"after\"}"));

    assertEquals(List.of("before", "after"), lines(target));
  }

  @Test
  void hardLinkedPathsShareOneHandle() throws IOException {
    Path original = tempDir.resolve("a.log");
    Path link = tempDir.resolve("b.log");
    Files.createFile(original);
    try {
      Files.createLink(link, original);
    } catch (UnsupportedOperationException | IOException ex) {
      assumeTrue(false, "hard links not supported: " + ex);
    }
    adapter = new FileOutputAdapter(Template.compile(tempDir + "/{name}.log"));

    adapter.feed(record("{\"name\":\"a\",\"message\":\"one\"}"));
    adapter.feed(record("{\"name\":\"b\",\"message\":\"two\"}"));

    assertEquals(1, adapter.openHandleCount());
    assertEquals(List.of("one", "two"), lines(original));
  }

  @Test
  void differentSpellingsOfOnePathShareOneHandle() throws IOException {
    Files.createDirectories(tempDir.resolve("logs"));
    adapter = new FileOutputAdapter(Template.compile(tempDir + "/{dir}/x.log"));

    adapter.feed(record("{\"dir\":\"logs\",\"message\":\"one\"}"));
    adapter.feed(record("{\"dir\":\"logs/../logs\",\"message\":\"two\"}"));

    assertEquals(1, adapter.openHandleCount());
    assertEquals(List.of("one", "two"), lines(tempDir.resolve("logs/x.log")));
  }

  @Test
  void dropsRecordWhenPathKeyMissingAndKeepsRunning() throws IOException {
    RecordingMetrics metrics = new RecordingMetrics();
    adapter = new FileOutputAdapter(
        "files", Template.compile(tempDir + "/{source}.log"), Template.compile("{message}"), metrics);

    adapter.feed(record("{\"message\":\"no source\"}"));
    adapter.feed(record("{\"source\":\"app\",\"message\":\"ok\"}"));

    assertEquals(1, metrics.counter("output.files.dropped.path"));
    assertEquals(List.of("ok"), lines(tempDir.resolve("app.log")));
  }

  @Test
  void dropsRecordWhenMessageCannotRender() throws IOException {
    RecordingMetrics metrics = new RecordingMetrics();
    adapter = new FileOutputAdapter(
        "files", Template.compile(tempDir + "/out.log"), Template.compile("{payload}"), metrics);

    adapter.feed(record("{\"message\":\"x\",\"payload\":{\"nested\":true}}"));
    adapter.feed(record("{\"message\":\"x\",\"payload\":\"flat\"}"));

    assertEquals(1, metrics.counter("output.files.dropped.message"));
    assertEquals(List.of("flat"), lines(tempDir.resolve("out.log")));
  }

  @Test
  void closeReleasesHandles() throws IOException {
    adapter = new FileOutputAdapter(Template.compile(tempDir + "/{n}.log"));
    adapter.feed(record("{\"n\":1,\"message\":\"a\"}"));
    adapter.feed(record("{\"n\":2,\"message\":\"b\"}"));
    assertEquals(2, adapter.openHandleCount());

    adapter.close();

    assertEquals(0, adapter.openHandleCount());
    assertTrue(Files.exists(tempDir.resolve("1.log")));
    assertFalse(Files.exists(tempDir.resolve("3.log")));
  }

  private static LogRecord record(String json) {
    return LogRecord.of(ValueBuilder.over(new StringReader(json)).next());
  }

  private static List<String> lines(Path path) throws IOException {
    return Files.readAllLines(path, StandardCharsets.UTF_8);
  }
}
