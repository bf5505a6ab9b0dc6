/**
 * <strong>Purpose:</strong> Per-record statistic declarations and their evaluator.
 * <p><strong>Pipeline role:</strong> First stage; turns one activity or organisation tree into a map of shaped
 * statistic values.</p>
 * <p><strong>Concurrency:</strong> Declarations are immutable and shared; a {@link
 * org.codeforiati.stats.application.leaf.LeafContext} is confined to the thread evaluating its record.</p>
 * <p><strong>Observability:</strong> Failing statistics are logged at WARN and counted as
 * {@code stats.statistic.anomaly}.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.application.leaf;
