/**
 * Parsed record trees, their grouping keys and lenient date helpers.
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.domain.record;
