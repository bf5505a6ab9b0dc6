package org.codeforiati.stats.domain.currency;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts amounts to USD against an {@link ExchangeRateTable}.
 * <p><strong>Why:</strong> Financial roll-ups compare publishers in a common currency.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Missing rates are logged at DEBUG; nothing is thrown.</p>
 *
 * <p>A missing currency, a missing year or a zero rate contributes zero rather than failing the aggregation. This
 * under-counts unconvertible amounts, which is accepted since rate data is frequently absent for old or exotic
 * currencies.</p>
 *
 * @since 0.1.0
 */
public final class CurrencyConverter {
  private static final Logger log = LoggerFactory.getLogger(CurrencyConverter.class);

  private final ExchangeRateTable rates;

  public CurrencyConverter(ExchangeRateTable rates) {
    this.rates = Objects.requireNonNull(rates, "rates");
  }

  /**
   * Converts an amount to USD.
   *
   * @param currency ISO 4217 code; {@code null} yields zero
   * @param amount amount in {@code currency}; {@code null} yields zero
   * @param year year whose rate applies; years past coverage use the latest rate
   * @return {@code amount / rate}, or zero when no usable rate exists
   */
  public BigDecimal toUsd(String currency, BigDecimal amount, int year) {
    if (currency == null || amount == null) {
      return BigDecimal.ZERO;
    }
    Optional<BigDecimal> rate = rates.rate(currency, year);
    if (rate.isEmpty()) {
      log.debug("No exchange rate for {} in {}; counting as zero", currency, year);
      return BigDecimal.ZERO;
    }
    if (rate.get().signum() == 0) {
      log.debug("Zero exchange rate for {} in {}; counting as zero", currency, year);
      return BigDecimal.ZERO;
    }
    return amount.divide(rate.get(), MathContext.DECIMAL128);
  }

  public ExchangeRateTable rates() {
    return rates;
  }
}
