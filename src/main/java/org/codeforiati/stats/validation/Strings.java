package org.codeforiati.stats.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation utilities for configuration values.
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> Validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d{2}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  /**
   * Validates a standard version label of the form {@code major.minor}, e.g. {@code 1.01}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate version
   * @return trimmed version
   * @throws IllegalArgumentException if the value is not a {@code major.minor} label
   */
  public static String requireVersion(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!VERSION_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name, "must look like 1.01 or 2.03"));
    }
    return trimmed;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
