package org.codeforiati.stats.application.comprehensiveness;

import java.util.Objects;
import java.util.function.Predicate;
import org.codeforiati.stats.application.leaf.LeafContext;

/**
 * One completeness criterion.
 *
 * @param name criterion key in the comprehensiveness counters
 * @param presence the field exists
 * @param validity the field exists and satisfies format, codelist or percentage constraints
 * @param denominator when non-null, decides whether the record counts towards this criterion at all
 * @since 0.1.0
 */
public record ComprehensivenessCriterion(
    String name,
    Predicate<LeafContext> presence,
    Predicate<LeafContext> validity,
    Predicate<LeafContext> denominator) {

  public ComprehensivenessCriterion {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(presence, "presence");
    Objects.requireNonNull(validity, "validity");
  }

  /** Criterion whose validity test is its presence test. */
  static ComprehensivenessCriterion presenceOnly(String name, Predicate<LeafContext> presence) {
    return new ComprehensivenessCriterion(name, presence, presence, null);
  }

  /** Criterion whose validity test refines the presence test. */
  static ComprehensivenessCriterion refined(
      String name, Predicate<LeafContext> presence, Predicate<LeafContext> stricter) {
    return new ComprehensivenessCriterion(name, presence, presence.and(stricter), null);
  }

  ComprehensivenessCriterion withDenominator(Predicate<LeafContext> applies) {
    return new ComprehensivenessCriterion(name, presence, validity, applies);
  }

  public boolean hasDenominatorOverride() {
    return denominator != null;
  }

  /** Whether the record counts towards this criterion. */
  public boolean applies(LeafContext ctx) {
    return denominator == null || denominator.test(ctx);
  }
}
