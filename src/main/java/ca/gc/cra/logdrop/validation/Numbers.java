package ca.gc.cra.logdrop.validation;

/**
 * Numeric validation helpers for queue capacities, batch limits, intervals, and ports.
 * <p>Stateless; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates an int-valued setting within an inclusive range.
   *
   * @param name logical parameter name
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static int requireRange(String name, int value, int min, int max) {
    return (int) requireRange(name, (long) value, (long) min, (long) max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
