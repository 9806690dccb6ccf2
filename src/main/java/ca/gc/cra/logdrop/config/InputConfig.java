package ca.gc.cra.logdrop.config;

import ca.gc.cra.logdrop.validation.Net;
import ca.gc.cra.logdrop.validation.Strings;

/**
 * Listener definition for one input.
 *
 * @param type input kind; only {@code tcp} is supported
 * @param host bind address
 * @param port bind port; {@code 0} selects an ephemeral port
 * @param codec stream codec, {@code json} or {@code msgpack}
 * @since 0.1.0
 */
public record InputConfig(String type, String host, int port, String codec) {
  public static final String TYPE_TCP = "tcp";
  public static final String CODEC_JSON = "json";
  public static final String CODEC_MSGPACK = "msgpack";

  public InputConfig {
    type = Strings.requireNonBlank("inputs.type", type);
    if (!TYPE_TCP.equals(type)) {
      throw new IllegalArgumentException("Unsupported input type: " + type);
    }
    host = Net.requireHost("inputs.host", host);
    Net.requirePort("inputs.port", port, true);
    codec = Strings.requireNonBlank("inputs.codec", codec);
    if (!CODEC_JSON.equals(codec) && !CODEC_MSGPACK.equals(codec)) {
      throw new IllegalArgumentException("Unsupported input codec: " + codec);
    }
  }
}
