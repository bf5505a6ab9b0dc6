/**
 * Exchange rate table and USD conversion.
 */
package org.codeforiati.stats.domain.currency;
