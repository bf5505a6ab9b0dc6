/**
 * JSON rendering of aggregates and corpus reports with Jackson's streaming API.
 */
package org.codeforiati.stats.infrastructure.export;
