package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.List;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/** Statistics of organisation records. */
public final class OrganisationStatistics {
  static final String ROOT_PATH = "iati-organisation";

  private OrganisationStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        summed("organisations", Shape.NUMBER, ctx -> NumberStat.ONE),
        summed("elements_total", Shape.COUNTER1, ctx -> ElementCounter.countOccurrences(ctx.element(), ROOT_PATH)),
        summed("elements", Shape.COUNTER1, ctx -> ElementCounter.presence(ctx.counter1("elements_total"))));
  }
}
