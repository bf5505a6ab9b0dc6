package org.codeforiati.stats.application.comprehensiveness;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.List;
import org.codeforiati.stats.application.leaf.LeafContext;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Scores current activities against {@link ComprehensivenessCriteria#ALL}.
 * <p><strong>Why:</strong> Numerators and denominators are emitted as summed counters so that any group can
 * compute a satisfaction rate per criterion. A criterion with a denominator override only scores when the record
 * counts in that denominator, so a numerator never exceeds its denominator.</p>
 * <p>Non-current records contribute empty numerator and denominator counters and a zero default
 * denominator.</p>
 *
 * @since 0.1.0
 */
public final class ComprehensivenessEngine {
  private static final String SCORE_FACT = "comprehensiveness";

  private ComprehensivenessEngine() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        summed("comprehensiveness", Shape.COUNTER1, ctx -> score(ctx).presence()),
        summed("comprehensiveness_with_validation", Shape.COUNTER1, ctx -> score(ctx).validity()),
        summed("comprehensiveness_denominators", Shape.COUNTER1, ctx -> score(ctx).denominators()),
        summed("comprehensiveness_denominator_default", Shape.NUMBER,
            ctx -> NumberStat.of(score(ctx).defaultDenominator())),
        summed("comprehensiveness_current_activities", Shape.COUNTER2,
            ctx -> Counter2.builder().add(ctx.facts().identifier(), score(ctx).status().code(), 1).build()));
  }

  /** Score for the record in {@code ctx}, computed once per record. */
  public static ComprehensivenessScore score(LeafContext ctx) {
    return ctx.fact(SCORE_FACT, ComprehensivenessEngine::compute);
  }

  static ComprehensivenessScore compute(LeafContext ctx) {
    CurrentStatus status = CurrentActivityClassifier.classify(ctx);
    if (!status.isCurrent()) {
      return ComprehensivenessScore.NOT_CURRENT;
    }
    Counter1.Builder presence = Counter1.builder();
    Counter1.Builder validity = Counter1.builder();
    Counter1.Builder denominators = Counter1.builder();
    for (ComprehensivenessCriterion criterion : ComprehensivenessCriteria.ALL) {
      boolean applies = criterion.applies(ctx);
      if (criterion.hasDenominatorOverride()) {
        denominators.put(criterion.name(), applies ? 1 : 0);
      }
      boolean present = applies && criterion.presence().test(ctx);
      boolean valid = present && criterion.validity().test(ctx);
      presence.put(criterion.name(), present ? 1 : 0);
      validity.put(criterion.name(), valid ? 1 : 0);
    }
    return new ComprehensivenessScore(status, presence.build(), validity.build(), denominators.build());
  }
}
