package org.codeforiati.stats.domain.record;

/** Kind of reporting unit, identified by the root element tag. */
public enum RecordKind {
  ACTIVITY("iati-activity"),
  ORGANISATION("iati-organisation");

  private final String rootTag;

  RecordKind(String rootTag) {
    this.rootTag = rootTag;
  }

  public String rootTag() {
    return rootTag;
  }

  /**
   * Resolves the kind for a root tag.
   *
   * @param tag root element tag
   * @return matching kind or {@code null} when the tag is not a reporting unit
   */
  public static RecordKind forRootTag(String tag) {
    for (RecordKind kind : values()) {
      if (kind.rootTag.equals(tag)) {
        return kind;
      }
    }
    return null;
  }
}
