package org.codeforiati.stats.domain.stats;

/** How a statistic combines across a group. */
public enum AggregationMode {
  /** Folded with the shape's merge rule. */
  SUMMED,
  /** Never folded; recomputed from the folded aggregate at each level, or kept only at the level it belongs to. */
  NO_AGGREGATION
}
