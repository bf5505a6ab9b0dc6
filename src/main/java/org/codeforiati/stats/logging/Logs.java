package org.codeforiati.stats.logging;

/**
 * <strong>What:</strong> Helpers that keep record content echoed into logs short.
 * <p><strong>Why:</strong> Identifiers and narrative values come from third-party data and can be arbitrarily
 * long or contain line breaks.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  /** Default character budget for identifiers in log lines. */
  public static final int IDENTIFIER_BUDGET = 120;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a value to {@code maxChars} characters and flattens line breaks.
   *
   * @param value value to shorten; {@code null} results in {@code "<null>"}
   * @param maxChars maximum characters to keep; must be positive
   * @return the value, or its prefix followed by {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    String flat = value.replace('\r', ' ').replace('\n', ' ');
    if (flat.length() <= maxChars) {
      return flat;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(flat.charAt(end - 1))) {
      end--;
    }
    return flat.substring(0, end) + "... (truncated, " + end + " of " + flat.length() + ")";
  }

  /** Shortens a record identifier with {@link #IDENTIFIER_BUDGET}. */
  public static String identifier(String value) {
    return truncate(value, IDENTIFIER_BUDGET);
  }
}
