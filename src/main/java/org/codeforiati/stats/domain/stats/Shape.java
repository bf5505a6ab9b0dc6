package org.codeforiati.stats.domain.stats;

/**
 * Result shapes a statistic may declare, with their merge identities.
 *
 * @since 0.1.0
 */
public enum Shape {
  /** Scalar count or sum. */
  NUMBER,
  /** key to number. */
  COUNTER1,
  /** key to {@link #COUNTER1}. */
  COUNTER2,
  /** key to {@link #COUNTER2}. */
  COUNTER3,
  /** name to a value of any shape; see {@link NestedStat}. */
  NESTED;

  /** Returns the zero or empty value that leaves any merge unchanged. */
  public StatResult identity() {
    return switch (this) {
      case NUMBER -> NumberStat.ZERO;
      case COUNTER1 -> Counter1.EMPTY;
      case COUNTER2 -> Counter2.EMPTY;
      case COUNTER3 -> Counter3.EMPTY;
      case NESTED -> NestedStat.EMPTY;
    };
  }
}
