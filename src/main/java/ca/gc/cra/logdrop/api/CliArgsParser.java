package ca.gc.cra.logdrop.api;

import ca.gc.cra.logdrop.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Turns {@code key=value} CLI arguments into a lookup map, rejecting keys the command does not know.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw {@code key=value} arguments; {@code null} returns an empty map
   * @param allowedKeys keys the command accepts
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException if an argument is malformed or its key is unknown
   */
  static Map<String, String> toMap(String[] args, Set<String> allowedKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = Strings.requireIdentifier("argument name", arg.substring(0, idx));
      if (!allowedKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
    }
    return map;
  }
}
