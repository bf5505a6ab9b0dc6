package org.codeforiati.stats.domain.currency;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class CurrencyConverterTest {
  private final CurrencyConverter converter = new CurrencyConverter(ExchangeRateTable.builder()
      .rate("EUR", 2013, new BigDecimal("0.8"))
      .rate("EUR", 2015, new BigDecimal("0.9"))
      .rate("XOF", 2015, BigDecimal.ZERO)
      .build());

  @Test
  void dividesByRateForYear() {
    BigDecimal usd = converter.toUsd("EUR", BigDecimal.valueOf(100), 2013);
    assertEquals(0, BigDecimal.valueOf(125).compareTo(usd));
  }

  @Test
  void yearsAfterCoverageUseLatestRate() {
    BigDecimal usd = converter.toUsd("EUR", BigDecimal.valueOf(90), 2030);
    assertEquals(0, BigDecimal.valueOf(100).compareTo(usd));
  }

  @Test
  void gapsAndEarlyYearsContributeZero() {
    assertEquals(0, converter.toUsd("EUR", BigDecimal.TEN, 2014).signum());
    assertEquals(0, converter.toUsd("EUR", BigDecimal.TEN, 2000).signum());
  }

  @Test
  void unknownCurrencyZeroRateAndMissingInputsContributeZero() {
    assertEquals(0, converter.toUsd("JPY", BigDecimal.TEN, 2015).signum());
    assertEquals(0, converter.toUsd("XOF", BigDecimal.TEN, 2015).signum());
    assertEquals(0, converter.toUsd(null, BigDecimal.TEN, 2015).signum());
    assertEquals(0, converter.toUsd("EUR", null, 2015).signum());
  }

  @Test
  void tableReportsLatestYear() {
    assertEquals(2015, converter.rates().latestYear("EUR").orElseThrow());
    assertTrue(converter.rates().latestYear("JPY").isEmpty());
  }
}
