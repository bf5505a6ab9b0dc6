package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.TreeMap;
import org.codeforiati.stats.domain.record.IsoDates;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.NestedStat;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * Descriptive statistics of a single activity: identity, structure coverage, dates and transaction timing.
 *
 * @since 0.1.0
 */
public final class ActivityStatistics {
  static final String ROOT_PATH = "iati-activity";
  /** Day thresholds of {@code transaction_timing}. */
  static final List<Integer> TIMING_BUCKETS = List.of(30, 60, 90, 180, 360);
  private static final List<String> BOOLEAN_PATHS = List.of(
      "conditions/@attached",
      "crs-add/aidtype-flag/@significance",
      "crs-add/other-flags/@significance",
      "fss/@priority",
      "@humanitarian",
      "reporting-org/@secondary-reporter",
      "result/indicator/@ascending",
      "result/@aggregation-status",
      "transaction/@humanitarian");

  /** Statistics reported again per hierarchy level in {@code by_hierarchy}. */
  static final List<String> BY_HIERARCHY = List.of(
      "activities",
      "elements",
      "elements_total",
      "forwardlooking_currency_year",
      "forwardlooking_activities_current",
      "forwardlooking_activities_with_budgets",
      "forwardlooking_activities_with_budget_not_provided",
      "comprehensiveness",
      "comprehensiveness_with_validation",
      "comprehensiveness_denominators",
      "comprehensiveness_denominator_default");

  private ActivityStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        summed("activities", Shape.NUMBER, ctx -> NumberStat.ONE),
        summed("iati_identifiers", Shape.COUNTER1, ActivityStatistics::iatiIdentifiers),
        summed("hierarchies", Shape.COUNTER1, ctx -> Counter1.label(ctx.element().attribute("hierarchy"))),
        summed("currencies", Shape.COUNTER1, ActivityStatistics::currencies),
        summed("activities_per_year", Shape.COUNTER1, ctx -> Counter1.label(ctx.facts().startYear())),
        summed("elements_total", Shape.COUNTER1, ctx -> ElementCounter.countOccurrences(ctx.element(), ROOT_PATH)),
        summed("elements", Shape.COUNTER1, ctx -> ElementCounter.presence(ctx.counter1("elements_total"))),
        summed("boolean_values", Shape.COUNTER2, ActivityStatistics::booleanValues),
        summed("provider_org", Shape.COUNTER1, ctx -> transactionOrgRefs(ctx, "provider-org")),
        summed("receiver_org", Shape.COUNTER1, ctx -> transactionOrgRefs(ctx, "receiver-org")),
        summed("transactions_incoming_funds", Shape.COUNTER1, ActivityStatistics::transactionsIncomingFunds),
        summed("transaction_timing", Shape.COUNTER1, ActivityStatistics::transactionTiming),
        summed("transaction_months", Shape.COUNTER1, ActivityStatistics::transactionMonths),
        summed("transaction_months_with_year", Shape.COUNTER1, ActivityStatistics::transactionMonthsWithYear),
        summed("budget_lengths", Shape.COUNTER1, ActivityStatistics::budgetLengths),
        summed("activities_secondary_reported", Shape.COUNTER1, ActivityStatistics::secondaryReported),
        summed("transaction_dates", Shape.COUNTER2, ActivityStatistics::transactionDates),
        summed("activity_dates", Shape.COUNTER2, ctx -> activityDates(ctx.element())),
        summed("activity_dates_humanitarian", Shape.COUNTER2, ActivityStatistics::activityDatesHumanitarian),
        summed("activities_with_future_transactions", Shape.NUMBER, ActivityStatistics::futureTransactions),
        summed("provider_activity_id", Shape.COUNTER1, ActivityStatistics::providerActivityIds),
        summed("transaction_total", Shape.NUMBER,
            ctx -> NumberStat.of(ctx.element().children("transaction").size())),
        summed("by_hierarchy", Shape.NESTED, ActivityStatistics::byHierarchy));
  }

  // Missing hierarchy counts as level 1.
  static StatResult byHierarchy(LeafContext ctx) {
    TreeMap<String, StatResult> values = new TreeMap<>();
    for (String name : BY_HIERARCHY) {
      values.put(name, ctx.statistic(name));
    }
    String hierarchy = ctx.element().attribute("hierarchy");
    return NestedStat.of(hierarchy == null ? "1" : hierarchy, new NestedStat(values));
  }

  static StatResult iatiIdentifiers(LeafContext ctx) {
    Node id = ctx.element().child("iati-identifier");
    return id == null ? Counter1.EMPTY : Counter1.label(id.text());
  }

  static StatResult currencies(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    String defaultCurrency = ctx.element().attribute("default-currency");
    for (Node transaction : ctx.element().children("transaction")) {
      Node value = transaction.child("value");
      if (value == null) {
        continue;
      }
      String currency = value.attribute("currency");
      out.put(currency == null || currency.isEmpty() ? defaultCurrency : currency, 1);
    }
    return out.build();
  }

  static StatResult booleanValues(LeafContext ctx) {
    Counter2.Builder out = Counter2.builder();
    for (String path : BOOLEAN_PATHS) {
      for (String value : ctx.element().values(path)) {
        out.add(path, value, 1);
      }
    }
    return out.build();
  }

  static StatResult transactionOrgRefs(LeafContext ctx, String orgTag) {
    Counter1.Builder out = Counter1.builder();
    for (Node transaction : ctx.element().children("transaction")) {
      Node org = transaction.child(orgTag);
      if (org != null) {
        out.add(org.attribute("ref"), 1);
      }
    }
    return out.build();
  }

  static StatResult transactionsIncomingFunds(LeafContext ctx) {
    int incoming = ctx.facts().transactionsOfType(ctx.facts().incomingFundsCode()).size();
    if (incoming == 0) {
      return Counter1.EMPTY;
    }
    return Counter1.builder()
        .add("transactions_with_incoming_funds", incoming)
        .add("activities_with_incoming_funds", 1)
        .build();
  }

  /** Counts transactions dated less than each bucket's days before today; future ones beyond a day are ignored. */
  static StatResult transactionTiming(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    TIMING_BUCKETS.forEach(bucket -> out.add(bucket, 0));
    for (Node transaction : ctx.element().children("transaction")) {
      LocalDate date = IsoDates.transactionDate(transaction);
      if (date == null) {
        continue;
      }
      long days = ChronoUnit.DAYS.between(date, ctx.today());
      if (days < -1) {
        continue;
      }
      for (int bucket : TIMING_BUCKETS) {
        if (days < bucket) {
          out.add(bucket, 1);
        }
      }
    }
    return out.build();
  }

  static StatResult transactionMonths(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    for (Node transaction : ctx.element().children("transaction")) {
      LocalDate date = IsoDates.transactionDate(transaction);
      if (date != null) {
        out.add(date.getMonthValue(), 1);
      }
    }
    return out.build();
  }

  static StatResult transactionMonthsWithYear(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    for (Node transaction : ctx.element().children("transaction")) {
      LocalDate date = IsoDates.transactionDate(transaction);
      if (date != null) {
        out.add(String.format("%d-%02d", date.getYear(), date.getMonthValue()), 1);
      }
    }
    return out.build();
  }

  static StatResult budgetLengths(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    for (Node budget : ctx.element().children("budget")) {
      LocalDate start = IsoDates.of(budget.child("period-start"));
      LocalDate end = IsoDates.of(budget.child("period-end"));
      if (start != null && end != null) {
        out.add(ChronoUnit.DAYS.between(start, end), 1);
      }
    }
    return out.build();
  }

  static StatResult secondaryReported(LeafContext ctx) {
    return ctx.facts().isSecondaryReported() ? Counter1.label(ctx.facts().identifier()) : Counter1.EMPTY;
  }

  static StatResult transactionDates(LeafContext ctx) {
    Counter2.Builder out = Counter2.builder();
    for (Node transaction : ctx.element().children("transaction")) {
      out.add(ctx.facts().transactionType(transaction), IsoDates.transactionDate(transaction), 1);
    }
    return out.build();
  }

  static Counter2 activityDates(Node activity) {
    Counter2.Builder out = Counter2.builder();
    for (Node date : activity.children("activity-date")) {
      out.add(date.attribute("type"), IsoDates.of(date), 1);
    }
    return out.build();
  }

  static StatResult activityDatesHumanitarian(LeafContext ctx) {
    String flag = ctx.element().attribute("humanitarian");
    if ("1".equals(flag) || "true".equals(flag)) {
      return activityDates(ctx.element());
    }
    return Counter2.EMPTY;
  }

  static StatResult futureTransactions(LeafContext ctx) {
    for (Node transaction : ctx.element().children("transaction")) {
      LocalDate date = IsoDates.transactionDate(transaction);
      if (date != null && date.isAfter(ctx.today())) {
        return NumberStat.ONE;
      }
    }
    return NumberStat.ZERO;
  }

  /** Activities this one names as funding providers, excluding itself. */
  static StatResult providerActivityIds(LeafContext ctx) {
    String own = ctx.facts().identifier();
    Counter1.Builder out = Counter1.builder();
    for (String id : ctx.element().values("transaction/provider-org/@provider-activity-id")) {
      if (!id.equals(own)) {
        out.add(id, 1);
      }
    }
    return out.build();
  }
}
