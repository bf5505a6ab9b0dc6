package org.codeforiati.stats.domain.record;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient date extraction from record elements.
 *
 * <p>Unparseable or absent dates resolve to {@code null}; callers treat them as missing data rather than errors.</p>
 *
 * @since 0.1.0
 */
public final class IsoDates {
  private static final Pattern DATE_PREFIX = Pattern.compile("^(-?\\d{4,})-(\\d{2})-(\\d{2})");
  /** Budgets spanning more than this many days are not attributed to a single year. */
  static final long MAX_BUDGET_SPAN_DAYS = 370;

  private IsoDates() {
    // Utility
  }

  /**
   * Parses the leading {@code yyyy-mm-dd} portion of a raw value.
   *
   * @param raw raw attribute or text value
   * @return parsed date or {@code null} when absent or invalid
   */
  public static LocalDate parse(String raw) {
    if (raw == null) {
      return null;
    }
    Matcher m = DATE_PREFIX.matcher(raw.trim());
    if (!m.find()) {
      return null;
    }
    try {
      return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    } catch (DateTimeException | NumberFormatException ex) {
      return null;
    }
  }

  /** Reads {@code @iso-date}, falling back to the element text when the attribute is empty. */
  public static LocalDate of(Node element) {
    if (element == null) {
      return null;
    }
    String raw = element.attribute("iso-date");
    if (raw == null || raw.isEmpty()) {
      raw = element.text();
    }
    return parse(raw);
  }

  /** Transaction date: {@code transaction-date}, otherwise {@code value/@value-date}. */
  public static LocalDate transactionDate(Node transaction) {
    Node date = transaction.child("transaction-date");
    if (date != null) {
      return of(date);
    }
    Node value = transaction.child("value");
    return value == null ? null : parse(value.attribute("value-date"));
  }

  /**
   * Year a budget period is attributed to.
   *
   * @param budget {@code budget} element
   * @return start year (end year when the start is missing), or {@code null} when the period is unknown or spans
   *     more than a year
   */
  public static Integer budgetYear(Node budget) {
    LocalDate start = of(budget.child("period-start"));
    LocalDate end = of(budget.child("period-end"));
    if (start != null && end != null && ChronoUnit.DAYS.between(start, end) > MAX_BUDGET_SPAN_DAYS) {
      return null;
    }
    if (start != null) {
      return start.getYear();
    }
    return end == null ? null : end.getYear();
  }

  /** Planned disbursement year: period start, else period end. */
  public static Integer plannedDisbursementYear(Node plannedDisbursement) {
    LocalDate start = of(plannedDisbursement.child("period-start"));
    if (start != null) {
      return start.getYear();
    }
    LocalDate end = of(plannedDisbursement.child("period-end"));
    return end == null ? null : end.getYear();
  }

  /**
   * Shifts a date by whole years, mapping 29 February to 1 March when the target year has no leap day.
   */
  public static LocalDate addYears(LocalDate date, int years) {
    int targetYear = date.getYear() + years;
    if (date.getMonthValue() == 2 && date.getDayOfMonth() == 29 && !Year.isLeap(targetYear)) {
      return LocalDate.of(targetYear, 3, 1);
    }
    return date.withYear(targetYear);
  }
}
