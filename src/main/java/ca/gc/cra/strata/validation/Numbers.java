package ca.gc.cra.strata.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used while loading STRATA configuration.
 * <p><strong>Why:</strong> Buffer sizes, queue capacities and intervals must be checked before sinks and
 * dispatchers allocate resources.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
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
   * Validates that an int value is at least one and at most {@code max}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is not in {@code [1, max]}
   */
  public static int requirePositive(String name, int value, int max) {
    return (int) requireRange(name, value, 1, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
