package org.codeforiati.stats.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class IsoDatesTest {

  @Test
  void parsesLeadingDateAndIgnoresSuffix() {
    assertEquals(LocalDate.of(2020, 1, 31), IsoDates.parse("2020-01-31T10:00:00Z"));
    assertEquals(LocalDate.of(2020, 1, 31), IsoDates.parse(" 2020-01-31 "));
  }

  @Test
  void invalidDatesAreMissing() {
    assertNull(IsoDates.parse(null));
    assertNull(IsoDates.parse("31/01/2020"));
    assertNull(IsoDates.parse("2020-02-30"));
  }

  @Test
  void elementFallsBackToTextWhenAttributeEmpty() {
    Node date = Node.builder("activity-date").attribute("iso-date", "").text("2019-05-01").build();
    assertEquals(LocalDate.of(2019, 5, 1), IsoDates.of(date));
  }

  @Test
  void transactionDateFallsBackToValueDate() {
    Node transaction = Node.builder("transaction")
        .child(Node.builder("value").attribute("value-date", "2018-07-04").text("10"))
        .build();
    assertEquals(LocalDate.of(2018, 7, 4), IsoDates.transactionDate(transaction));
  }

  @Test
  void budgetYearUsesStartAndRejectsLongPeriods() {
    Node annual = budget("2021-04-01", "2022-03-31");
    Node endOnly = budget(null, "2022-03-31");
    Node multiYear = budget("2021-01-01", "2023-01-01");

    assertEquals(2021, IsoDates.budgetYear(annual));
    assertEquals(2022, IsoDates.budgetYear(endOnly));
    assertNull(IsoDates.budgetYear(multiYear));
  }

  @Test
  void addYearsMapsLeapDayToFirstOfMarch() {
    assertEquals(LocalDate.of(2023, 3, 1), IsoDates.addYears(LocalDate.of(2024, 2, 29), -1));
    assertEquals(LocalDate.of(2020, 2, 29), IsoDates.addYears(LocalDate.of(2024, 2, 29), -4));
    assertEquals(LocalDate.of(2023, 6, 10), IsoDates.addYears(LocalDate.of(2024, 6, 10), -1));
  }

  private static Node budget(String start, String end) {
    Node.Builder budget = Node.builder("budget");
    if (start != null) {
      budget.child(Node.builder("period-start").attribute("iso-date", start));
    }
    if (end != null) {
      budget.child(Node.builder("period-end").attribute("iso-date", end));
    }
    return budget.build();
  }
}
