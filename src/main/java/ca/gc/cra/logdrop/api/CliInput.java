package ca.gc.cra.logdrop.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into the command, normalized flags, and {@code key=value} pairs.
 */
final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String command;
  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String command, String[] keyValueArgs, Set<String> flags) {
    this.command = command;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. The first bare token without {@code '='} becomes the command.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(null, new String[0], Set.of());
    }
    String command = null;
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (command == null && !arg.contains("=")) {
        command = lower;
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(command, kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns the command token, lowercased.
   *
   * @return command or {@code null} when none was given
   */
  String command() {
    return command;
  }

  String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  boolean help() {
    return flags.contains("--help");
  }

  boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags other than help and verbose, for rejecting unknown switches.
   *
   * @param known flags the command accepts
   * @return unrecognized flags in the order given
   */
  List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !known.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
