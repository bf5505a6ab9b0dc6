package org.codeforiati.stats.application.leaf;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Run-wide evaluation parameters.
 *
 * @param today evaluation date used by every date-sensitive statistic
 * @param legacyVersion version assumed when a document declares none or an unrecognised one
 * @param usdClampYear when set, transaction years after it are converted at this year's rate; {@code null} relies
 *     on the exchange table's own latest-year clamp
 * @since 0.1.0
 */
public record EvaluationSettings(LocalDate today, String legacyVersion, Integer usdClampYear) {
  public static final String DEFAULT_LEGACY_VERSION = "1.01";

  public EvaluationSettings {
    Objects.requireNonNull(today, "today");
    Objects.requireNonNull(legacyVersion, "legacyVersion");
  }

  public static EvaluationSettings forDate(LocalDate today) {
    return new EvaluationSettings(today, DEFAULT_LEGACY_VERSION, null);
  }

  /** Applies {@link #usdClampYear()} to a transaction year. */
  public int clampUsdYear(int year) {
    return usdClampYear != null && year > usdClampYear ? usdClampYear : year;
  }
}
