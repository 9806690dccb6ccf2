package ca.gc.cra.logdrop.config;

import ca.gc.cra.logdrop.application.pipeline.DispatcherSettings;
import ca.gc.cra.logdrop.application.pipeline.OutputBinding;
import ca.gc.cra.logdrop.config.OutputConfig.BulkOutputConfig;
import ca.gc.cra.logdrop.config.OutputConfig.FileOutputConfig;
import ca.gc.cra.logdrop.config.OutputConfig.NullOutputConfig;
import ca.gc.cra.logdrop.infrastructure.input.tcp.TcpInputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.bulk.BulkIndexOutputAdapter;
import ca.gc.cra.logdrop.infrastructure.output.bulk.JettyBulkTransport;
import ca.gc.cra.logdrop.infrastructure.output.file.FileOutputAdapter;
import ca.gc.cra.logdrop.validation.Net;
import ca.gc.cra.logdrop.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link RouterConfig} from a YAML document.
 *
 * <p>Every section is optional; an empty document yields the default dispatcher with no inputs or outputs.
 * Unknown keys are rejected so typos surface at startup instead of silently falling back to defaults.
 * Outputs without a {@code name} are named after their type, suffixed with their position when that name is
 * already taken.</p>
 */
public final class YamlConfigLoader {
  static final String DEFAULT_BULK_HOST = "localhost";
  static final int DEFAULT_BULK_PORT = 9200;
  static final String DEFAULT_BULK_INDEX = "logs";
  static final String DEFAULT_BULK_TYPE = "log";

  private static final Set<String> ROOT_KEYS = Set.of("dispatcher", "inputs", "outputs", "logLevel");
  private static final Set<String> DISPATCHER_KEYS = Set.of("requiredField", "ingestCapacity");
  private static final Set<String> INPUT_KEYS = Set.of("type", "host", "port", "codec");
  private static final Set<String> FILE_KEYS = Set.of("type", "name", "path", "format", "queueCapacity");
  private static final Set<String> BULK_KEYS =
      Set.of("type", "name", "host", "port", "index", "docType", "url", "limit", "intervalMillis",
          "queueCapacity");
  private static final Set<String> NULL_KEYS = Set.of("type", "name", "queueCapacity");

  private YamlConfigLoader() {}

  /**
   * Loads the configuration stored at {@code path}.
   *
   * @param path YAML file
   * @return parsed configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or fails validation
   */
  public static RouterConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses configuration from an open reader.
   *
   * @param reader YAML source; not closed
   * @param source description of the source used in error messages
   * @return parsed configuration
   * @throws IllegalArgumentException when the YAML is malformed or fails validation
   */
  public static RouterConfig parse(Reader reader, String source) {
    Objects.requireNonNull(reader, "reader");
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return new RouterConfig(DispatcherSettings.defaults(), List.of(), List.of(), Optional.empty());
    }
    Map<String, Object> root = asMap(document, "root");
    requireKnownKeys(root, ROOT_KEYS, "root");

    DispatcherSettings dispatcher = root.get("dispatcher") == null
        ? DispatcherSettings.defaults()
        : dispatcher(asMap(root.get("dispatcher"), "dispatcher"));

    List<InputConfig> inputs = new ArrayList<>();
    for (Object node : asList(root.get("inputs"), "inputs")) {
      inputs.add(input(asMap(node, "inputs[" + inputs.size() + "]")));
    }

    List<OutputConfig> outputs = new ArrayList<>();
    Set<String> taken = new HashSet<>();
    List<Object> outputNodes = asList(root.get("outputs"), "outputs");
    for (int i = 0; i < outputNodes.size(); i++) {
      OutputConfig output = output(asMap(outputNodes.get(i), "outputs[" + i + "]"), i, taken);
      taken.add(output.name());
      outputs.add(output);
    }

    Optional<String> logLevel = Optional.ofNullable(root.get("logLevel"))
        .map(value -> Strings.requireNonBlank("logLevel", value.toString()));
    return new RouterConfig(dispatcher, inputs, outputs, logLevel);
  }

  private static DispatcherSettings dispatcher(Map<String, Object> section) {
    requireKnownKeys(section, DISPATCHER_KEYS, "dispatcher");
    String requiredField = string(section, "requiredField", DispatcherSettings.DEFAULT_REQUIRED_FIELD, "dispatcher");
    int ingestCapacity = integer(section, "ingestCapacity", DispatcherSettings.DEFAULT_INGEST_CAPACITY, "dispatcher");
    if (ingestCapacity <= 0) {
      throw new IllegalArgumentException("dispatcher.ingestCapacity must be positive");
    }
    return new DispatcherSettings(
        Strings.requireNonBlank("dispatcher.requiredField", requiredField),
        ingestCapacity);
  }

  private static InputConfig input(Map<String, Object> section) {
    requireKnownKeys(section, INPUT_KEYS, "inputs");
    return new InputConfig(
        string(section, "type", InputConfig.TYPE_TCP, "inputs"),
        string(section, "host", TcpInputAdapter.DEFAULT_HOST, "inputs"),
        integer(section, "port", TcpInputAdapter.DEFAULT_PORT, "inputs"),
        string(section, "codec", InputConfig.CODEC_JSON, "inputs"));
  }

  private static OutputConfig output(Map<String, Object> section, int index, Set<String> taken) {
    String context = "outputs[" + index + "]";
    if (!section.containsKey("type")) {
      throw new IllegalArgumentException(context + ".type is required");
    }
    // YAML reads a bare `type: null` as a null scalar
    Object rawType = section.get("type");
    String type = rawType == null ? "null" : rawType.toString().trim().toLowerCase(Locale.ROOT);
    String name = section.get("name") == null
        ? defaultName(type, index, taken)
        : Strings.requireIdentifier(context + ".name", section.get("name").toString());
    int queueCapacity = integer(section, "queueCapacity", OutputBinding.DEFAULT_QUEUE_CAPACITY, context);

    return switch (type) {
      case "file" -> {
        requireKnownKeys(section, FILE_KEYS, context);
        String path = string(section, "path", null, context);
        if (path == null) {
          throw new IllegalArgumentException(context + ".path is required for file outputs");
        }
        String format = string(section, "format", FileOutputAdapter.DEFAULT_MESSAGE_FORMAT, context);
        yield new FileOutputConfig(name, path, format, queueCapacity);
      }
      case "bulk" -> {
        requireKnownKeys(section, BULK_KEYS, context);
        yield new BulkOutputConfig(
            name,
            bulkEndpoint(section, context),
            integer(section, "limit", BulkIndexOutputAdapter.DEFAULT_LIMIT, context),
            longValue(section, "intervalMillis", BulkIndexOutputAdapter.DEFAULT_FLUSH_INTERVAL.toMillis(), context),
            queueCapacity);
      }
      case "null" -> {
        requireKnownKeys(section, NULL_KEYS, context);
        yield new NullOutputConfig(name, queueCapacity);
      }
      default -> throw new IllegalArgumentException("Unsupported output type at " + context + ": " + type);
    };
  }

  private static URI bulkEndpoint(Map<String, Object> section, String context) {
    String url = string(section, "url", null, context);
    if (url != null) {
      if (section.containsKey("host") || section.containsKey("port") || section.containsKey("index")
          || section.containsKey("docType")) {
        throw new IllegalArgumentException(context + ".url cannot be combined with host, port, index, or docType");
      }
      try {
        return new URI(Strings.requireNonBlank(context + ".url", url));
      } catch (URISyntaxException ex) {
        throw new IllegalArgumentException(context + ".url is not a valid URI: " + url, ex);
      }
    }
    String host = Net.requireHost(context + ".host", string(section, "host", DEFAULT_BULK_HOST, context));
    int port = Net.requirePort(context + ".port", integer(section, "port", DEFAULT_BULK_PORT, context), false);
    String index = Strings.requireIdentifier(context + ".index", string(section, "index", DEFAULT_BULK_INDEX, context));
    String docType = Strings.requireIdentifier(
        context + ".docType", string(section, "docType", DEFAULT_BULK_TYPE, context));
    return JettyBulkTransport.endpoint(host, port, index, docType);
  }

  private static String defaultName(String type, int index, Set<String> taken) {
    return taken.contains(type) ? type + "-" + index : type;
  }

  private static void requireKnownKeys(Map<String, Object> section, Set<String> allowed, String context) {
    for (String key : section.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException("Unknown key '" + key + "' in " + context);
      }
    }
  }

  private static String string(Map<String, Object> section, String key, String fallback, String context) {
    Object value = section.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(context + "." + key + " must be a scalar");
    }
    return value.toString();
  }

  private static int integer(Map<String, Object> section, String key, int fallback, String context) {
    long value = longValue(section, key, fallback, context);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(context + "." + key + " is out of range: " + value);
    }
    return (int) value;
  }

  private static long longValue(Map<String, Object> section, String key, long fallback, String context) {
    Object value = section.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(context + "." + key + " must be an integer: " + text, ex);
      }
    }
    throw new IllegalArgumentException(context + "." + key + " must be an integer: " + value);
  }

  private static List<Object> asList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " section must be a list");
    }
    return new ArrayList<>(raw);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
