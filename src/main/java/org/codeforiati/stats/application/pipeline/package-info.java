/**
 * <strong>Purpose:</strong> Corpus aggregation use case: evaluate records, fold them per file, publisher and
 * corpus, and close each level with its group statistics.
 * <p><strong>Concurrency:</strong> Leaf evaluation runs on a bounded worker pool; folds run on the calling
 * thread.</p>
 * <p><strong>Metrics:</strong> Emits {@code stats.records.*}, {@code stats.leaf.latencyNanos} and
 * {@code stats.fold.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.application.pipeline;
