package org.codeforiati.stats.application.group;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.derived;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.codeforiati.stats.domain.record.IsoDates;
import org.codeforiati.stats.domain.reference.ReferenceSpend;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Per-publisher timeliness and reference statistics derived from the folded publisher
 * aggregate.
 * <p><strong>Why:</strong> Labels such as "Quarterly" or a median budget length have no meaningful sum across
 * publishers, so every declaration here is {@code NO_AGGREGATION}. Labels are encoded as a single key counted
 * once.</p>
 *
 * @since 0.1.0
 */
public final class PublisherTimeliness {
  static final String MONTHLY = "Monthly";
  static final String QUARTERLY = "Quarterly";
  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,9}");

  private PublisherTimeliness() {}

  public static List<StatisticDeclaration<GroupContext>> declarations() {
    return List.of(
        derived("transaction_frequency", Shape.COUNTER1, ctx -> Counter1.label(transactionFrequency(ctx))),
        derived("timelag", Shape.COUNTER1, ctx -> Counter1.label(timelag(ctx))),
        derived("transaction_alignment", Shape.COUNTER1, PublisherTimeliness::transactionAlignment),
        derived("budget_length_median", Shape.NUMBER,
            ctx -> budgetLengthMedian(ctx).map(NumberStat::new).orElse(NumberStat.ZERO)),
        derived("budget_alignment", Shape.COUNTER1, ctx -> Counter1.label(budgetAlignment(ctx))),
        derived("date_extremes", Shape.COUNTER3, PublisherTimeliness::dateExtremes),
        derived("most_recent_transaction_date", Shape.COUNTER1, ctx -> latestTransactionDate(ctx, true)),
        derived("latest_transaction_date", Shape.COUNTER1, ctx -> latestTransactionDate(ctx, false)),
        derived("reference_spend_data_usd", Shape.COUNTER2, PublisherTimeliness::referenceSpendUsd));
  }

  /** Frequency judged from how many of the last 30/60/90 day windows hold no transaction. */
  static String transactionFrequency(GroupContext ctx) {
    Counter1 timing = ctx.aggregate().counter1("transaction_timing");
    int emptyWindows = 0;
    for (String window : List.of("30", "60", "90")) {
      if (timing.get(window).signum() == 0) {
        emptyWindows++;
      }
    }
    if (emptyWindows <= 1) {
      return MONTHLY;
    } else if (emptyWindows <= 2) {
      return QUARTERLY;
    } else if (timing.get("180").signum() != 0) {
      return "Six-monthly";
    } else if (timing.get("360").signum() != 0) {
      return "Annual";
    }
    return "Beyond one year";
  }

  /** Lag judged from transactions in the twelve calendar months before the current one. */
  static String timelag(GroupContext ctx) {
    Counter1 months = ctx.aggregate().counter1("transaction_months_with_year");
    List<Boolean> reported = new ArrayList<>(12);
    YearMonth month = YearMonth.from(ctx.today());
    for (int i = 0; i < 12; i++) {
      month = month.minusMonths(1);
      reported.add(months.containsKey(String.format("%d-%02d", month.getYear(), month.getMonthValue())));
    }
    long lastQuarter = reported.subList(0, 3).stream().filter(Boolean::booleanValue).count();
    if (lastQuarter >= 2) {
      return "One month";
    } else if (lastQuarter >= 1) {
      return "A quarter";
    } else if (reported.subList(0, 6).contains(true)) {
      return "Six months";
    } else if (reported.contains(true)) {
      return "One year";
    }
    return "More than one year";
  }

  static StatResult transactionAlignment(GroupContext ctx) {
    Set<String> months = ctx.aggregate().counter1("transaction_months").values().keySet();
    Set<Integer> quarters = new HashSet<>();
    for (String month : months) {
      if (INTEGER.matcher(month).matches()) {
        quarters.add((Integer.parseInt(month) - 1) / 3);
      }
    }
    if (months.size() == 12) {
      return Counter1.label(MONTHLY);
    } else if (quarters.size() == 4) {
      return Counter1.label(QUARTERLY);
    } else if (!months.isEmpty()) {
      return Counter1.label("Annually");
    }
    return Counter1.EMPTY;
  }

  /**
   * Median budget length in days over the frequency table {@code budget_lengths}. When the median falls between
   * two bins it is their mean.
   */
  static Optional<BigDecimal> budgetLengthMedian(GroupContext ctx) {
    TreeMap<Long, BigDecimal> lengths = new TreeMap<>();
    for (Map.Entry<String, BigDecimal> entry : ctx.aggregate().counter1("budget_lengths").values().entrySet()) {
      if (INTEGER.matcher(entry.getKey()).matches()) {
        lengths.merge(Long.parseLong(entry.getKey()), entry.getValue(), BigDecimal::add);
      }
    }
    BigDecimal total = lengths.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    if (total.signum() == 0) {
      return Optional.empty();
    }
    BigDecimal half = total.divide(TWO);
    BigDecimal seen = BigDecimal.ZERO;
    BigDecimal median = null;
    for (Map.Entry<Long, BigDecimal> bin : lengths.entrySet()) {
      seen = seen.add(bin.getValue());
      if (seen.compareTo(half) >= 0) {
        BigDecimal length = BigDecimal.valueOf(bin.getKey());
        median = median == null ? length : median.add(length).divide(TWO);
        if (seen.compareTo(half) != 0) {
          break;
        }
      }
    }
    return Optional.ofNullable(median);
  }

  static String budgetAlignment(GroupContext ctx) {
    Optional<BigDecimal> median = budgetLengthMedian(ctx);
    if (median.isEmpty()) {
      return "Not known";
    } else if (median.get().compareTo(BigDecimal.valueOf(100)) < 0) {
      return QUARTERLY;
    } else if (median.get().compareTo(BigDecimal.valueOf(370)) < 0) {
      return "Annually";
    }
    return "Beyond one year";
  }

  /** Earliest and latest activity date, overall and by date type. */
  static StatResult dateExtremes(GroupContext ctx) {
    LocalDate overallMin = null;
    LocalDate overallMax = null;
    Counter3.Builder out = Counter3.builder();
    for (Map.Entry<String, Counter1> byType : ctx.aggregate().counter2("activity_dates").values().entrySet()) {
      LocalDate min = null;
      LocalDate max = null;
      for (String raw : byType.getValue().values().keySet()) {
        LocalDate date = IsoDates.parse(raw);
        if (date == null) {
          continue;
        }
        min = min == null || date.isBefore(min) ? date : min;
        max = max == null || date.isAfter(max) ? date : max;
      }
      if (min == null) {
        continue;
      }
      out.add("min", byType.getKey(), min, 1);
      out.add("max", byType.getKey(), max, 1);
      overallMin = overallMin == null || min.isBefore(overallMin) ? min : overallMin;
      overallMax = overallMax == null || max.isAfter(overallMax) ? max : overallMax;
    }
    if (overallMin != null) {
      out.add("min", "overall", overallMin, 1);
      out.add("max", "overall", overallMax, 1);
    }
    return out.build();
  }

  /**
   * Latest transaction date across all transaction types.
   *
   * @param notAfterToday when set, future dates are ignored
   */
  static StatResult latestTransactionDate(GroupContext ctx, boolean notAfterToday) {
    LocalDate latest = null;
    for (Counter1 byDate : ctx.aggregate().counter2("transaction_dates").values().values()) {
      for (String raw : byDate.values().keySet()) {
        LocalDate date = IsoDates.parse(raw);
        if (date == null || (notAfterToday && date.isAfter(ctx.today()))) {
          continue;
        }
        latest = latest == null || date.isAfter(latest) ? date : latest;
      }
    }
    return latest == null ? Counter1.EMPTY : Counter1.label(latest);
  }

  /**
   * Reference spend converted to USD at each year's rate, the official USD forecast, and the publisher's
   * reporting flags under key {@code flags}.
   */
  static StatResult referenceSpendUsd(GroupContext ctx) {
    Optional<ReferenceSpend> found = ctx.tables().referenceSpend(ctx.publisher());
    Counter2.Builder out = Counter2.builder();
    if (found.isEmpty()) {
      out.put("flags", "spend_data_error_reported", BigDecimal.ZERO);
      out.put("flags", "DAC", BigDecimal.ZERO);
      return out.build();
    }
    ReferenceSpend spend = found.get();
    spend.referenceSpend().forEach((year, amount) ->
        out.put(year, "ref_spend", ctx.converter().toUsd(spend.currency(), amount, year)));
    spend.officialForecastUsd().forEach((year, amount) -> out.put(year, "official_forecast", amount));
    out.put("flags", "spend_data_error_reported", spend.spendDataErrorReported() ? BigDecimal.ONE : BigDecimal.ZERO);
    out.put("flags", "DAC", spend.dac() ? BigDecimal.ONE : BigDecimal.ZERO);
    return out.build();
  }
}
