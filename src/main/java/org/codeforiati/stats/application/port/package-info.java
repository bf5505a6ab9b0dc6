/**
 * <strong>Purpose:</strong> Ports the application layer depends on: metrics, schema validation and the clock.
 * <p><strong>Pipeline role:</strong> Adapters in {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.application.port;
