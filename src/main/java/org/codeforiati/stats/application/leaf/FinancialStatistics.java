package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.record.IsoDates;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatKeys;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Financial roll-ups of transactions, budgets and planned disbursements, in original
 * currencies and in USD, plus the forward-looking budget coverage statistics.
 * <p><strong>Why:</strong> Sums use exact decimal arithmetic so that corpus totals over millions of transactions
 * carry no rounding drift.</p>
 * <p><strong>Observability:</strong> Unconvertible amounts fall back to zero inside {@link CurrencyConverter}.</p>
 *
 * @since 0.1.0
 */
public final class FinancialStatistics {
  static final String SUM_TRANSACTIONS = "sum_transactions_by_type_by_year";
  static final String SUM_TRANSACTIONS_USD = "sum_transactions_by_type_by_year_usd";
  static final String SUM_BUDGETS = "sum_budgets_by_type_by_year";
  static final String USD = "USD";
  /** Years covered by forward-looking statistics, starting with the current year. */
  static final int FORWARD_LOOKING_YEARS = 3;
  private static final BigDecimal SPENT_RATIO_EXCLUSION = new BigDecimal("0.9");

  private FinancialStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        summed("spend_currency_year", Shape.COUNTER2, FinancialStatistics::spendCurrencyYear),
        summed("count_transactions_by_type_by_year", Shape.COUNTER2, FinancialStatistics::countTransactions),
        summed(SUM_TRANSACTIONS, Shape.COUNTER3, FinancialStatistics::sumTransactions),
        summed(SUM_TRANSACTIONS_USD, Shape.COUNTER3, FinancialStatistics::sumTransactionsUsd),
        summed("count_budgets_by_type_by_year", Shape.COUNTER2, FinancialStatistics::countBudgets),
        summed(SUM_BUDGETS, Shape.COUNTER3, FinancialStatistics::sumBudgets),
        summed("sum_budgets_by_type_by_year_usd", Shape.COUNTER3, FinancialStatistics::sumBudgetsUsd),
        summed("count_planned_disbursements_by_year", Shape.COUNTER1, FinancialStatistics::countPlannedDisbursements),
        summed("sum_planned_disbursements_by_year", Shape.COUNTER2, FinancialStatistics::sumPlannedDisbursements),
        summed("sum_commitments_and_disbursements_by_activity_id_usd", Shape.COUNTER1,
            FinancialStatistics::commitmentsAndDisbursementsUsd),
        summed("forwardlooking_currency_year", Shape.COUNTER2, FinancialStatistics::forwardLookingCurrencyYear),
        summed("forwardlooking_activities_current", Shape.COUNTER1,
            ctx -> forwardLooking(ctx, year -> true)),
        summed("forwardlooking_activities_with_budgets", Shape.COUNTER1,
            ctx -> forwardLooking(ctx, year -> budgetYears(ctx).contains(year))),
        summed("forwardlooking_activities_with_budget_not_provided", Shape.COUNTER1,
            ctx -> forwardLooking(ctx, year -> ctx.facts().budgetNotProvided() != null)),
        summed("forwardlooking_excluded_activities", Shape.COUNTER2, FinancialStatistics::excludedActivities));
  }

  static StatResult spendCurrencyYear(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter2.Builder out = Counter2.builder();
    for (Node transaction : facts.transactionsOfType(facts.disbursementCode(), facts.expenditureCode())) {
      out.add(facts.transactionYear(transaction), facts.currencyOf(transaction), facts.amountOf(transaction));
    }
    return out.build();
  }

  static StatResult countTransactions(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter2.Builder out = Counter2.builder();
    for (Node transaction : ctx.element().children("transaction")) {
      out.add(facts.transactionType(transaction), facts.transactionYear(transaction), 1);
    }
    return out.build();
  }

  /** Incoming funds, commitments, disbursements and expenditure by type, currency and year. */
  static StatResult sumTransactions(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter3.Builder out = Counter3.builder();
    for (Node transaction : facts.transactionsOfType(facts.incomingFundsCode(), facts.commitmentCode(),
        facts.disbursementCode(), facts.expenditureCode())) {
      Integer year = facts.transactionYear(transaction);
      if (year != null) {
        out.add(facts.transactionType(transaction), facts.currencyOf(transaction), year, facts.amountOf(transaction));
      }
    }
    return out.build();
  }

  static StatResult sumTransactionsUsd(LeafContext ctx) {
    return toUsd(ctx.counter3(SUM_TRANSACTIONS), ctx.converter(), ctx.settings(), true);
  }

  static StatResult countBudgets(LeafContext ctx) {
    Counter2.Builder out = Counter2.builder();
    for (Node budget : ctx.element().children("budget")) {
      Integer year = IsoDates.budgetYear(budget);
      if (year != null) {
        out.add(budget.attribute("type"), year, 1);
      }
    }
    return out.build();
  }

  static StatResult sumBudgets(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter3.Builder out = Counter3.builder();
    for (Node budget : ctx.element().children("budget")) {
      Integer year = IsoDates.budgetYear(budget);
      if (year != null) {
        out.add(budget.attribute("type"), facts.currencyOf(budget), year, facts.amountOf(budget));
      }
    }
    return out.build();
  }

  static StatResult sumBudgetsUsd(LeafContext ctx) {
    return toUsd(ctx.counter3(SUM_BUDGETS), ctx.converter(), ctx.settings(), false);
  }

  static StatResult countPlannedDisbursements(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    for (Node pd : ctx.element().children("planned-disbursement")) {
      out.add(IsoDates.plannedDisbursementYear(pd), 1);
    }
    return out.build();
  }

  static StatResult sumPlannedDisbursements(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter2.Builder out = Counter2.builder();
    for (Node pd : ctx.element().children("planned-disbursement")) {
      out.add(facts.currencyOf(pd), IsoDates.plannedDisbursementYear(pd), facts.amountOf(pd));
    }
    return out.build();
  }

  /** Total USD commitments and disbursements keyed by activity identifier; empty when the total is zero. */
  static StatResult commitmentsAndDisbursementsUsd(LeafContext ctx) {
    Counter3 usd = ctx.counter3(SUM_TRANSACTIONS_USD);
    BigDecimal total = BigDecimal.ZERO;
    for (String type : List.of("C", "2", "D", "3")) {
      for (BigDecimal value : usd.get(type).get(USD).values().values()) {
        total = total.add(value);
      }
    }
    if (total.signum() == 0) {
      return Counter1.EMPTY;
    }
    return Counter1.builder().add(ctx.facts().identifier(), total).build();
  }

  /**
   * Converts a type, currency, year sum to type, {@code USD}, year.
   *
   * @param clampYears whether {@link EvaluationSettings#usdClampYear()} applies
   */
  static Counter3 toUsd(Counter3 sums, CurrencyConverter converter, EvaluationSettings settings, boolean clampYears) {
    Counter3.Builder out = Counter3.builder();
    for (Map.Entry<String, Counter2> byType : sums.values().entrySet()) {
      for (Map.Entry<String, Counter1> byCurrency : byType.getValue().values().entrySet()) {
        String currency = byCurrency.getKey();
        if (StatKeys.NULL.equals(currency)) {
          continue;
        }
        for (Map.Entry<String, BigDecimal> byYear : byCurrency.getValue().values().entrySet()) {
          Integer year = parseYear(byYear.getKey());
          if (year == null) {
            continue;
          }
          int effectiveYear = clampYears ? settings.clampUsdYear(year) : year;
          BigDecimal converted = converter.toUsd(currency, byYear.getValue(), effectiveYear);
          out.add(byType.getKey(), USD, effectiveYear, converted);
        }
      }
    }
    return out.build();
  }

  static StatResult forwardLookingCurrencyYear(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Counter2.Builder out = Counter2.builder();
    for (Node budget : ctx.element().children("budget")) {
      out.add(IsoDates.budgetYear(budget), facts.currencyOf(budget), facts.amountOf(budget));
    }
    return out.build();
  }

  private interface YearCondition {
    boolean test(int year);
  }

  private static StatResult forwardLooking(LeafContext ctx, YearCondition condition) {
    int thisYear = ctx.today().getYear();
    Counter1.Builder out = Counter1.builder();
    for (int year = thisYear; year < thisYear + FORWARD_LOOKING_YEARS; year++) {
      boolean counted = isCurrentInYear(ctx, year) && condition.test(year) && exclusionCode(ctx, year) == 0;
      out.add(year, counted ? 1 : 0);
    }
    return out.build();
  }

  static StatResult excludedActivities(LeafContext ctx) {
    int thisYear = ctx.today().getYear();
    Counter2.Builder out = Counter2.builder();
    String id = ctx.facts().identifier();
    for (int year = thisYear; year < thisYear + FORWARD_LOOKING_YEARS; year++) {
      out.add(id, year, exclusionCode(ctx, year));
    }
    return out.build();
  }

  private static List<Integer> budgetYears(LeafContext ctx) {
    List<Integer> years = new ArrayList<>();
    for (Node budget : ctx.element().children("budget")) {
      years.add(IsoDates.budgetYear(budget));
    }
    return years;
  }

  /** Current in a year: no end dates at all, or at least one planned or actual end in that year or later. */
  static boolean isCurrentInYear(LeafContext ctx, int year) {
    ActivityFacts facts = ctx.facts();
    List<LocalDate> ends = new ArrayList<>(facts.activityDates(facts.plannedEndCode()));
    ends.addAll(facts.activityDates(facts.actualEndCode()));
    if (ends.isEmpty()) {
      return true;
    }
    for (LocalDate end : ends) {
      if (end.getYear() >= year) {
        return true;
      }
    }
    return false;
  }

  /**
   * Forward-looking exclusion: {@code 1} when the activity ends within six months of today, {@code 2} when at least
   * 90% of USD commitments were disbursed or spent by the end of {@code year}, otherwise {@code 0}.
   */
  static int exclusionCode(LeafContext ctx, int year) {
    LocalDate end = ctx.facts().endDate();
    if (end != null && ctx.today().plusMonths(6).isAfter(end)) {
      return 1;
    }
    BigDecimal ratio = spentRatio(ctx, year);
    return ratio != null && ratio.compareTo(SPENT_RATIO_EXCLUSION) >= 0 ? 2 : 0;
  }

  private static BigDecimal spentRatio(LeafContext ctx, int year) {
    ActivityFacts facts = ctx.facts();
    BigDecimal committed = usdTotal(ctx, facts.transactionsOfType(facts.commitmentCode()), Integer.MAX_VALUE);
    if (committed.signum() <= 0) {
      return null;
    }
    BigDecimal spent = usdTotal(ctx, facts.transactionsOfType(facts.disbursementCode(), facts.expenditureCode()), year);
    return spent.divide(committed, MathContext.DECIMAL64);
  }

  private static BigDecimal usdTotal(LeafContext ctx, List<Node> transactions, int maxYear) {
    ActivityFacts facts = ctx.facts();
    BigDecimal total = BigDecimal.ZERO;
    for (Node transaction : transactions) {
      String currency = facts.currencyOf(transaction);
      Node value = transaction.child("value");
      BigDecimal amount = value == null ? null : ValueFormats.parseDecimal(value.text());
      Integer transactionYear = facts.transactionYear(transaction);
      if (currency == null || amount == null || transactionYear == null || transactionYear > maxYear) {
        continue;
      }
      total = total.add(ctx.converter().toUsd(currency, amount, transactionYear));
    }
    return total;
  }

  private static Integer parseYear(String key) {
    try {
      return Integer.valueOf(key);
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
