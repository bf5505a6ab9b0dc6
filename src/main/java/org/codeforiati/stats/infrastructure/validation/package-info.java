/**
 * Schema validation adapters.
 */
package org.codeforiati.stats.infrastructure.validation;
