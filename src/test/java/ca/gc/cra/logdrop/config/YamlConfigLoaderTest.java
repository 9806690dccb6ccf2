package ca.gc.cra.logdrop.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logdrop.application.pipeline.DispatcherSettings;
import ca.gc.cra.logdrop.application.pipeline.OutputBinding;
import ca.gc.cra.logdrop.config.OutputConfig.BulkOutputConfig;
import ca.gc.cra.logdrop.config.OutputConfig.FileOutputConfig;
import ca.gc.cra.logdrop.config.OutputConfig.NullOutputConfig;
import ca.gc.cra.logdrop.infrastructure.input.tcp.TcpInputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.bulk.BulkIndexOutputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.file.FileOutputAdapter;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @Test
  void loadsCompleteConfiguration(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("router.yaml");
    Files.writeString(file, String.join("\n",
        "logLevel: DEBUG",
        "dispatcher:",
        "  requiredField: msg",
        "  ingestCapacity: 16",
        "inputs:",
        "  - type: tcp",
        "    host: 127.0.0.1",
        "    port: 5140",
        "outputs:",
        "  - type: file",
        "    name: archive",
        "    path: /var/log/{host}.log",
        "    format: \"{host} {msg}\"",
        "    queueCapacity: 8",
        "  - type: bulk",
        "    host: es.internal",
        "    port: 9201",
        "    index: app",
        "    docType: event",
        "    limit: 50",
        "    intervalMillis: 1000",
        "  - type: null",
        ""), StandardCharsets.UTF_8);

    RouterConfig config = YamlConfigLoader.load(file);

    assertEquals(Optional.of("DEBUG"), config.logLevel());
    assertEquals(new DispatcherSettings("msg", 16), config.dispatcher());
    assertEquals(1, config.inputs().size());
    assertEquals(new InputConfig("tcp", "127.0.0.1", 5140, "json"), config.inputs().get(0));

    assertEquals(3, config.outputs().size());
    assertEquals(new FileOutputConfig("archive", "/var/log/{host}.log", "{host} {msg}", 8), config.outputs().get(0));
    BulkOutputConfig bulk = assertInstanceOf(BulkOutputConfig.class, config.outputs().get(1));
    assertEquals("bulk", bulk.name());
    assertEquals(URI.create("http://es.internal:9201/app/event/_bulk"), bulk.endpoint());
    assertEquals(50, bulk.limit());
    assertEquals(1000L, bulk.intervalMillis());
    assertEquals(new NullOutputConfig("null", OutputBinding.DEFAULT_QUEUE_CAPACITY), config.outputs().get(2));
  }

  @Test
  void emptyDocumentYieldsDefaults() {
    RouterConfig config = parse("");

    assertEquals(DispatcherSettings.defaults(), config.dispatcher());
    assertTrue(config.inputs().isEmpty());
    assertTrue(config.outputs().isEmpty());
    assertTrue(config.logLevel().isEmpty());
  }

  @Test
  void appliesOutputDefaults() {
    RouterConfig config = parse(String.join("\n",
        "inputs:",
        "  - {}",
        "outputs:",
        "  - type: file",
        "    path: out.log",
        "  - type: file",
        "    path: other.log",
        "  - type: bulk"));

    assertEquals("::", config.inputs().get(0).host());
    assertEquals(10053, config.inputs().get(0).port());
    FileOutputConfig first = assertInstanceOf(FileOutputConfig.class, config.outputs().get(0));
    assertEquals("file", first.name());
    assertEquals(FileOutputAdapter.DEFAULT_MESSAGE_FORMAT, first.format());
    assertEquals("file-1", config.outputs().get(1).name());
    BulkOutputConfig bulk = assertInstanceOf(BulkOutputConfig.class, config.outputs().get(2));
    assertEquals(URI.create("http://localhost:9200/logs/log/_bulk"), bulk.endpoint());
    assertEquals(BulkIndexOutputAdapter.DEFAULT_LIMIT, bulk.limit());
    assertEquals(BulkIndexOutputAdapter.DEFAULT_FLUSH_INTERVAL.toMillis(), bulk.intervalMillis());
  }

  @Test
  void acceptsExplicitBulkUrl() {
    RouterConfig config = parse(String.join("\n",
        "outputs:",
        "  - type: bulk",
        "    url: https://search.example:443/logs/log/_bulk"));

    BulkOutputConfig bulk = assertInstanceOf(BulkOutputConfig.class, config.outputs().get(0));
    assertEquals(URI.create("https://search.example:443/logs/log/_bulk"), bulk.endpoint());
  }

  @Test
  void rejectsUrlCombinedWithHost() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parse(String.join("\n",
        "outputs:",
        "  - type: bulk",
        "    url: http://a:9200/x/y/_bulk",
        "    host: b")));
    assertTrue(ex.getMessage().contains("cannot be combined"), ex.getMessage());
  }

  @Test
  void rejectsUnknownKeys() {
    IllegalArgumentException root = assertThrows(IllegalArgumentException.class, () -> parse("output: []"));
    assertTrue(root.getMessage().contains("'output'"), root.getMessage());

    IllegalArgumentException nested = assertThrows(IllegalArgumentException.class, () -> parse(String.join("\n",
        "outputs:",
        "  - type: file",
        "    path: a.log",
        "    limit: 3")));
    assertTrue(nested.getMessage().contains("'limit'"), nested.getMessage());
  }

  @Test
  void rejectsMissingTypeAndUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - name: x"));
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - type: kafka"));
    assertThrows(IllegalArgumentException.class, () -> parse("inputs:\n  - type: udp"));
    assertThrows(IllegalArgumentException.class, () -> parse("inputs:\n  - codec: protobuf"));
  }

  @Test
  void outputWithoutTypeKeyIsRejectedButExplicitNullIsDiscard() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - name: sink"));
    assertEquals("outputs[0].type is required", ex.getMessage());

    RouterConfig config = parse("outputs:\n  - {type: null, name: sink}");
    assertEquals(List.of(new NullOutputConfig("sink", OutputBinding.DEFAULT_QUEUE_CAPACITY)), config.outputs());
  }

  @Test
  void acceptsMessagePackCodec() {
    RouterConfig config = parse("inputs:\n  - {port: 10053, codec: msgpack}");

    assertEquals(
        List.of(new InputConfig("tcp", TcpInputAdapter.DEFAULT_HOST, 10053, InputConfig.CODEC_MSGPACK)),
        config.inputs());
  }

  @Test
  void rejectsFileOutputWithoutPath() {
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - type: file"));
  }

  @Test
  void rejectsDuplicateOutputNames() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parse(String.join("\n",
        "outputs:",
        "  - {type: null, name: sink}",
        "  - {type: file, name: sink, path: a.log}")));
    assertTrue(ex.getMessage().contains("sink"), ex.getMessage());
  }

  @Test
  void rejectsInvalidNumbers() {
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - {type: bulk, port: 70000}"));
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - {type: bulk, limit: 0}"));
    assertThrows(IllegalArgumentException.class, () -> parse("outputs:\n  - {type: null, queueCapacity: many}"));
    assertThrows(IllegalArgumentException.class, () -> parse("dispatcher:\n  ingestCapacity: 0"));
  }

  @Test
  void acceptsNumericStrings() {
    RouterConfig config = parse("dispatcher:\n  ingestCapacity: \"32\"");
    assertEquals(32, config.dispatcher().ingestCapacity());
  }

  @Test
  void wrapsMalformedYaml() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parse("outputs: [\n"));
    assertTrue(ex.getMessage().contains("test.yaml"), ex.getMessage());
  }

  @Test
  void rejectsNonMappingRoot() {
    assertThrows(IllegalArgumentException.class, () -> parse("- a\n- b"));
  }

  private static RouterConfig parse(String yaml) {
    return YamlConfigLoader.parse(new StringReader(yaml), "test.yaml");
  }
}
