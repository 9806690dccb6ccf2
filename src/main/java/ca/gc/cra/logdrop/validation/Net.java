package ca.gc.cra.logdrop.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for input bind addresses and bulk index hosts.
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH    = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a host given as hostname, IPv4 literal, or IPv6 literal (bare such as {@code ::} or bracketed).
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate host
   * @return host without IPv6 brackets
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String requireHost(String name, String value) {
    String host = Strings.requireNonBlank(name, value);
    if (host.startsWith("[")) {
      if (!host.endsWith("]")) {
        throw new IllegalArgumentException(name + " must close IPv6 literal with ']'");
      }
      host = host.substring(1, host.length() - 1);
      validateIpv6(host);
      return host;
    }
    if (host.indexOf(':') >= 0) {
      validateIpv6(host);
      return host;
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return host;
    }
    validateHostname(host);
    return host;
  }

  /**
   * Validates a TCP port.
   *
   * @param name logical parameter name for diagnostics
   * @param port candidate port
   * @param allowEphemeral whether {@code 0} (pick any free port) is accepted
   * @return the validated port
   * @throws IllegalArgumentException if the port is out of range
   */
  public static int requirePort(String name, int port, boolean allowEphemeral) {
    return Numbers.requireRange(name, port, allowEphemeral ? 0 : 1, 65535);
  }

  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  /** Validates an IPv6 literal; a literal never triggers a DNS lookup. */
  private static void validateIpv6(String host) {
    for (int i = 0; i < host.length(); i++) {
      char c = host.charAt(i);
      if (!(Character.digit(c, 16) >= 0 || c == ':' || c == '.' || c == '%')) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    }
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
