/**
 * Validation helpers for configuration values.
 * <p><strong>Errors:</strong> Failures raise {@link java.lang.IllegalArgumentException} naming the setting.</p>
 */
package org.codeforiati.stats.validation;
