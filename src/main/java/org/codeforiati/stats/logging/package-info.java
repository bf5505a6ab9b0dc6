/**
 * Logging helpers: runtime level changes for Logback and truncation of third-party values echoed into logs.
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.logging;
