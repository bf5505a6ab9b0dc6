/**
 * Engine configuration: YAML loading, override merging, validation and the composition root.
 * <p><strong>Precedence:</strong> overrides, then the {@code engine} section, then {@code common}, then
 * defaults.</p>
 *
 * @since 0.1.0
 */
package org.codeforiati.stats.config;
