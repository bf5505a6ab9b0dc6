package org.codeforiati.stats.domain.currency;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Historical exchange rates, currency to year to local-currency-per-USD.
 * <p><strong>Why:</strong> Loaded once at start-up and shared read-only by every worker thread.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}.</p>
 *
 * <p>Lookups for years after a currency's latest recorded year resolve to that latest year. Years before the first
 * recorded year, and gaps inside the covered range, are reported as missing.</p>
 *
 * @since 0.1.0
 */
public final class ExchangeRateTable {
  public static final ExchangeRateTable EMPTY = builder().build();

  private final Map<String, NavigableMap<Integer, BigDecimal>> rates;

  private ExchangeRateTable(Map<String, NavigableMap<Integer, BigDecimal>> rates) {
    this.rates = rates;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the rate for a currency and year, clamping years beyond coverage to the latest year.
   *
   * @param currency ISO 4217 code
   * @param year calendar year
   * @return the recorded rate, possibly zero; empty when no rate applies
   */
  public Optional<BigDecimal> rate(String currency, int year) {
    if (currency == null) {
      return Optional.empty();
    }
    NavigableMap<Integer, BigDecimal> byYear = rates.get(currency);
    if (byYear == null || byYear.isEmpty()) {
      return Optional.empty();
    }
    int effectiveYear = Math.min(year, byYear.lastKey());
    return Optional.ofNullable(byYear.get(effectiveYear));
  }

  /** Latest year with a rate for the currency, if any. */
  public Optional<Integer> latestYear(String currency) {
    NavigableMap<Integer, BigDecimal> byYear = rates.get(currency);
    return byYear == null || byYear.isEmpty() ? Optional.empty() : Optional.of(byYear.lastKey());
  }

  public boolean isEmpty() {
    return rates.isEmpty();
  }

  /** Accumulates rates; the last value wins for a repeated currency and year. */
  public static final class Builder {
    private final Map<String, TreeMap<Integer, BigDecimal>> rates = new HashMap<>();

    private Builder() {}

    public Builder rate(String currency, int year, BigDecimal rate) {
      Objects.requireNonNull(currency, "currency");
      Objects.requireNonNull(rate, "rate");
      rates.computeIfAbsent(currency, c -> new TreeMap<>()).put(year, rate);
      return this;
    }

    public ExchangeRateTable build() {
      Map<String, NavigableMap<Integer, BigDecimal>> copy = new HashMap<>();
      rates.forEach((currency, byYear) ->
          copy.put(currency, Collections.unmodifiableNavigableMap(new TreeMap<>(byYear))));
      return new ExchangeRateTable(Collections.unmodifiableMap(copy));
    }
  }
}
