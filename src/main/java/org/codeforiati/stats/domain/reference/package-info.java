/**
 * Read-only reference data: codelists by major version, country languages and reference spend.
 */
package org.codeforiati.stats.domain.reference;
