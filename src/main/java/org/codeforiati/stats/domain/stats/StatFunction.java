package org.codeforiati.stats.domain.stats;

/**
 * Pure statistic body evaluated against a context.
 *
 * @param <C> context type: a single record or a folded group
 */
@FunctionalInterface
public interface StatFunction<C> {
  /**
   * Computes the statistic.
   *
   * @param context evaluation context
   * @return result, or {@code null} to signal "no data" (mapped to the shape identity)
   */
  StatResult apply(C context);
}
