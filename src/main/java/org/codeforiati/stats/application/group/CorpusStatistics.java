package org.codeforiati.stats.application.group;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Statistics closed once over the whole corpus.
 * <p><strong>Role:</strong> Traceability compares each publisher's activities against the activity ids other
 * publishers cite as funding providers. An activity is traceable when someone else references it.</p>
 *
 * @since 0.1.0
 */
public final class CorpusStatistics {
  private CorpusStatistics() {}

  public static List<StatisticDeclaration<GroupContext>> declarations() {
    return List.of(
        summed("unique_identifiers", Shape.NUMBER,
            ctx -> NumberStat.of(ctx.aggregate().counter1("iati_identifiers").size())),
        summed("duplicate_identifiers", Shape.COUNTER1,
            ctx -> GroupCounters.duplicates(ctx.aggregate().counter1("iati_identifiers"))),
        summed("traceable_sum_commitments_and_disbursements_by_publisher_id", Shape.COUNTER1,
            ctx -> traceable(ctx, "sum_commitments_and_disbursements_by_activity_id_by_publisher_id_usd", true)),
        summed("traceable_sum_commitments_and_disbursements_by_publisher_id_denominator", Shape.COUNTER1,
            ctx -> traceable(ctx, "sum_commitments_and_disbursements_by_activity_id_by_publisher_id_usd", false)),
        summed("traceable_activities_by_publisher_id", Shape.COUNTER1,
            ctx -> traceable(ctx, "iati_identifiers_by_publisher_id", true)),
        summed("traceable_activities_by_publisher_id_denominator", Shape.COUNTER1,
            ctx -> traceable(ctx, "iati_identifiers_by_publisher_id", false)));
  }

  /**
   * Totals a publisher-by-activity counter per publisher.
   *
   * @param byPublisher name of a publisher to activity id to amount statistic
   * @param referencedOnly when set, only activities cited by other publishers are totalled
   */
  static Counter1 traceable(GroupContext ctx, String byPublisher, boolean referencedOnly) {
    Counter1 cited = ctx.aggregate().counter1("provider_activity_id_without_own");
    Predicate<String> counts = referencedOnly ? cited::containsKey : id -> true;
    Counter2 perPublisher = ctx.aggregate().counter2(byPublisher);
    Counter1.Builder out = Counter1.builder();
    for (Map.Entry<String, Counter1> publisher : perPublisher.values().entrySet()) {
      BigDecimal total = BigDecimal.ZERO;
      for (Map.Entry<String, BigDecimal> activity : publisher.getValue().values().entrySet()) {
        if (counts.test(activity.getKey())) {
          total = total.add(activity.getValue());
        }
      }
      out.add(publisher.getKey(), total);
    }
    return out.build();
  }
}
