package org.codeforiati.stats.application.group;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.NestedStat;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * Summed statistics closed once per publisher. Summed into the corpus, they count publishers rather than
 * files or records.
 *
 * @since 0.1.0
 */
public final class PublisherStatistics {
  private static final Pattern INTEGER = Pattern.compile("\\s*([+-]?\\d{1,9})\\s*");

  private PublisherStatistics() {}

  public static List<StatisticDeclaration<GroupContext>> declarations() {
    return List.of(
        summed("publishers", Shape.NUMBER, ctx -> NumberStat.ONE),
        summed("publishers_per_version", Shape.COUNTER1,
            ctx -> GroupCounters.presence(ctx.aggregate().counter1("versions"))),
        summed("publishers_validation", Shape.COUNTER1, PublisherStatistics::validation),
        summed("publisher_has_org_file", Shape.COUNTER1,
            ctx -> Counter1.label(ctx.aggregate().number("organisation_files").signum() > 0 ? "yes" : "no")),
        summed("publisher_unique_identifiers", Shape.NUMBER,
            ctx -> NumberStat.of(ctx.aggregate().counter1("iati_identifiers").size())),
        summed("publisher_duplicate_identifiers", Shape.COUNTER1,
            ctx -> GroupCounters.duplicates(ctx.aggregate().counter1("iati_identifiers"))),
        summed("provider_activity_id_without_own", Shape.COUNTER1, PublisherStatistics::providerActivityIdsWithoutOwn),
        summed("sum_commitments_and_disbursements_by_activity_id_by_publisher_id_usd", Shape.COUNTER2,
            ctx -> byPublisher(ctx, "sum_commitments_and_disbursements_by_activity_id_usd")),
        summed("iati_identifiers_by_publisher_id", Shape.COUNTER2, ctx -> byPublisher(ctx, "iati_identifiers")),
        summed("bottom_hierarchy", Shape.NESTED, PublisherStatistics::bottomHierarchy));
  }

  static StatResult validation(GroupContext ctx) {
    return Counter1.label(ctx.aggregate().counter1("validation").containsKey("fail") ? "fail" : "pass");
  }

  /** Provider activity ids referenced by this publisher that are not its own activities. */
  static StatResult providerActivityIdsWithoutOwn(GroupContext ctx) {
    Aggregate aggregate = ctx.aggregate();
    Counter1 own = aggregate.counter1("iati_identifiers");
    return GroupCounters.filterKeys(aggregate.counter1("provider_activity_id"), id -> !own.containsKey(id));
  }

  /**
   * The {@code by_hierarchy} group of the publisher's deepest numeric hierarchy level.
   *
   * @return that group; empty when no level is numeric or the deepest level was published as e.g. {@code "02"}
   */
  static StatResult bottomHierarchy(GroupContext ctx) {
    NestedStat byHierarchy = ctx.aggregate().nested("by_hierarchy");
    Integer bottom = null;
    for (String level : byHierarchy.values().keySet()) {
      Matcher numeric = INTEGER.matcher(level);
      if (numeric.matches()) {
        int value = Integer.parseInt(numeric.group(1));
        bottom = bottom == null ? value : Math.max(bottom, value);
      }
    }
    return bottom == null ? NestedStat.EMPTY : byHierarchy.group(String.valueOf(bottom));
  }

  private static StatResult byPublisher(GroupContext ctx, String statistic) {
    Counter1 values = ctx.aggregate().counter1(statistic);
    if (values.isEmpty()) {
      return Counter2.EMPTY;
    }
    return Counter2.builder().addAll(ctx.publisher(), values).build();
  }
}
