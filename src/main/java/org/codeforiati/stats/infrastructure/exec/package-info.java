/**
 * Executor factories for the record evaluation worker pool.
 * <p><strong>Concurrency:</strong> Bounded queue with caller-runs back pressure.</p>
 */
package org.codeforiati.stats.infrastructure.exec;
