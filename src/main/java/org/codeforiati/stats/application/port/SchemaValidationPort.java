package org.codeforiati.stats.application.port;

import org.codeforiati.stats.domain.record.Record;

/**
 * <strong>What:</strong> Structural validity oracle for a record against a schema version.
 * <p><strong>Why:</strong> Schema validation is an external collaborator; only the {@code validation} statistic
 * consults it.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from worker threads.</p>
 *
 * @since 0.1.0
 */
public interface SchemaValidationPort {
  /**
   * Validates a record.
   *
   * @param record record to check
   * @param schemaVersion target schema version, e.g. {@code 2.03}
   * @return {@code true} when valid; {@code false} when invalid or the version has no schema
   */
  boolean isValid(Record record, String schemaVersion);
}
