/**
 * System clock adapter.
 */
package org.codeforiati.stats.infrastructure.time;
