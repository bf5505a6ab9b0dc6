package org.codeforiati.stats.domain.stats;

/**
 * Converts arbitrary key material to counter keys.
 *
 * <p>Absent keys are kept as the literal {@value #NULL} so that records lacking a field are still counted.</p>
 */
public final class StatKeys {
  /** Key used when the source value is absent. */
  public static final String NULL = "null";

  private StatKeys() {
    // Utility
  }

  public static String key(Object value) {
    return value == null ? NULL : value.toString();
  }
}
