/**
 * <strong>Purpose:</strong> Statistic value shapes, declarations and folded aggregates.
 * <p><strong>Invariants:</strong> Values are immutable; every shape has an identity and merges by exact
 * {@link java.math.BigDecimal} addition.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.domain.stats;
