package org.codeforiati.stats.domain.record;

/**
 * Signals that an input is not a well-formed record tree and cannot be evaluated at all.
 *
 * <p>Only the affected record is skipped; aggregation of the rest of the corpus continues.</p>
 *
 * @since 0.1.0
 */
public class MalformedRecordException extends Exception {
  private static final long serialVersionUID = 1L;

  public MalformedRecordException(String message) {
    super(message);
  }

  public MalformedRecordException(String message, Throwable cause) {
    super(message, cause);
  }
}
