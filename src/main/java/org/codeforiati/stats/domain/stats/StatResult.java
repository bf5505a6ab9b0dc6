package org.codeforiati.stats.domain.stats;

/**
 * <strong>What:</strong> Tagged statistic value of exactly one {@link Shape}.
 * <p><strong>Why:</strong> A closed hierarchy lets the merge machinery dispatch on shape without per-statistic code.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface StatResult permits NumberStat, Counter1, Counter2, Counter3, NestedStat {
  /** Shape tag of this value. */
  Shape shape();

  /** Whether this value equals its shape's identity. */
  boolean isEmpty();
}
