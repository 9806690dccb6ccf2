package ca.gc.cra.logdrop.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback levels at router startup.
 * <p><strong>Why:</strong> Lets operators raise verbosity with {@code --verbose} or the {@code logLevel} config key
 * without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name.
   *
   * @param levelName one of {@code TRACE, DEBUG, INFO, WARN, ERROR, OFF}, case-insensitive
   * @return {@code true} when the backend accepted the change
   * @throws IllegalArgumentException if {@code levelName} is not a known level
   */
  public static boolean applyRootLevel(String levelName) {
    Level level = parseLevel(levelName);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
        log.debug("Root log level set to {}", level);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }

  static Level parseLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("log level must not be blank");
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("Unknown log level: " + levelName);
    }
    return level;
  }
}
