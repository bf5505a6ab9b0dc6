package org.codeforiati.stats.application.group;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.List;
import org.codeforiati.stats.application.leaf.CommonStatistics;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/** Statistics closed once per source file. */
public final class FileStatistics {
  private FileStatistics() {}

  public static List<StatisticDeclaration<GroupContext>> declarations() {
    return List.of(
        summed("activity_files", Shape.NUMBER,
            ctx -> NumberStat.of(ctx.aggregate().number("activities").signum() > 0)),
        summed("organisation_files", Shape.NUMBER,
            ctx -> NumberStat.of(ctx.aggregate().number("organisations").signum() > 0)),
        summed("versions", Shape.COUNTER1,
            ctx -> GroupCounters.presence(ctx.aggregate().counter1(CommonStatistics.DOCUMENT_VERSIONS))));
  }
}
