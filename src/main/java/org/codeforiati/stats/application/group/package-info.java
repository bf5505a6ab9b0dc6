/**
 * Statistics computed once per file, publisher or corpus from an already folded aggregate.
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.application.group;
