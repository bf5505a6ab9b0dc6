package org.codeforiati.stats.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing.
 * <p><strong>Why:</strong> Rejects worker counts and queue capacities outside supported bounds before the pipeline
 * allocates threads.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Throws {@link IllegalArgumentException} when validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value.
   *
   * @param name parameter name for diagnostics
   * @param raw raw text
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer
   */
  public static int parseInt(String name, String raw) {
    try {
      return Integer.parseInt(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be an integer (was " + raw + ")", ex);
    }
  }
}
