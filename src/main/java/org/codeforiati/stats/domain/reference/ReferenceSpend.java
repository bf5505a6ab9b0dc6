package org.codeforiati.stats.domain.reference;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Published reference spend figures for one publisher.
 *
 * @param publisherName display name
 * @param currency currency of {@code referenceSpend}
 * @param referenceSpend year to reference spend in {@code currency}
 * @param officialForecastUsd year to official forecast, already in USD
 * @param spendDataErrorReported whether the publisher reported an error in its spend data
 * @param dac whether the publisher is a DAC member
 * @since 0.1.0
 */
public record ReferenceSpend(
    String publisherName,
    String currency,
    SortedMap<Integer, BigDecimal> referenceSpend,
    SortedMap<Integer, BigDecimal> officialForecastUsd,
    boolean spendDataErrorReported,
    boolean dac) {

  public ReferenceSpend {
    referenceSpend = Collections.unmodifiableSortedMap(
        new TreeMap<>(Objects.requireNonNull(referenceSpend, "referenceSpend")));
    officialForecastUsd = Collections.unmodifiableSortedMap(
        new TreeMap<>(Objects.requireNonNull(officialForecastUsd, "officialForecastUsd")));
  }

  /**
   * Parses a human formatted amount such as {@code 1,234.5}.
   *
   * @param raw raw cell text
   * @return parsed amount, or {@code null} when the cell is blank or not numeric
   */
  public static BigDecimal parseAmount(String raw) {
    if (raw == null) {
      return null;
    }
    String cleaned = raw.replace(",", "").trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(cleaned);
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
