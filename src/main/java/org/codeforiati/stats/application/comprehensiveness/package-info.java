/**
 * <strong>Purpose:</strong> Comprehensiveness scoring of single activities against publishing criteria.
 * <p><strong>Pipeline role:</strong> Leaf statistics; results are counters folded up the hierarchy like any
 * other summed statistic.</p>
 * <p><strong>Concurrency:</strong> Criteria are stateless; per-record state lives in the leaf context.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.application.comprehensiveness;
