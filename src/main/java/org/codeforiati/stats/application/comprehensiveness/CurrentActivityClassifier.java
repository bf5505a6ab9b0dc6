package org.codeforiati.stats.application.comprehensiveness;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.codeforiati.stats.application.leaf.ActivityFacts;
import org.codeforiati.stats.application.leaf.LeafContext;
import org.codeforiati.stats.domain.record.IsoDates;

/**
 * Stateless per-record classification of whether an activity is current; the first matching rule wins.
 *
 * @since 0.1.0
 */
public final class CurrentActivityClassifier {
  /** Activity status codes meaning implementation and post-completion. */
  static final Set<String> ACTIVE_STATUS_CODES = Set.of("2", "4");

  private CurrentActivityClassifier() {}

  public static CurrentStatus classify(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    LocalDate today = ctx.today();
    List<LocalDate> plannedEnds = facts.activityDates(facts.plannedEndCode());
    List<LocalDate> actualEnds = facts.activityDates(facts.actualEndCode());
    String status = ctx.element().firstValue("activity-status/@code");

    if (plannedEnds.isEmpty() && status != null && ACTIVE_STATUS_CODES.contains(status)) {
      return CurrentStatus.BY_STATUS;
    }
    LocalDate yearAgo = IsoDates.addYears(today, -1);
    for (LocalDate end : actualEnds) {
      if (!end.isBefore(yearAgo) && !end.isAfter(today)) {
        return CurrentStatus.BY_RECENT_ACTUAL_END;
      }
    }
    for (LocalDate end : plannedEnds) {
      if (!end.isBefore(today)) {
        return CurrentStatus.BY_FUTURE_PLANNED_END;
      }
    }
    return CurrentStatus.NOT_CURRENT;
  }
}
