package ca.gc.cra.logdrop.infrastructure.metrics;

import java.util.Locale;

/**
 * Splits router metric keys into an instrument name and an optional output attribute.
 *
 * <p>{@code output.<name>.<metric>} maps to instrument {@code logdrop.output.<metric>} with attribute
 * {@code output=<name>}, so every configured output shares one instrument per metric. Other keys map to
 * {@code logdrop.<key>}.</p>
 *
 * @param instrument sanitized OpenTelemetry instrument name
 * @param output output name, or {@code null} for router-wide metrics
 */
record MetricKey(String instrument, String output) {
  static final String PREFIX = "logdrop.";
  private static final String OUTPUT_PREFIX = "output.";
  private static final String FALLBACK = "logdrop.metric";

  static MetricKey parse(String key) {
    if (key == null || key.isBlank()) {
      return new MetricKey(FALLBACK, null);
    }
    String trimmed = key.trim();
    if (trimmed.startsWith(OUTPUT_PREFIX)) {
      int nameEnd = trimmed.indexOf('.', OUTPUT_PREFIX.length());
      if (nameEnd > OUTPUT_PREFIX.length() && nameEnd < trimmed.length() - 1) {
        String output = trimmed.substring(OUTPUT_PREFIX.length(), nameEnd);
        String metric = trimmed.substring(nameEnd + 1);
        return new MetricKey(sanitize(PREFIX + OUTPUT_PREFIX + metric), output);
      }
    }
    return new MetricKey(sanitize(PREFIX + trimmed), null);
  }

  private static String sanitize(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length());
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }
}
