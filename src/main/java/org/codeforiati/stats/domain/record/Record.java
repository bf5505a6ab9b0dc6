package org.codeforiati.stats.domain.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A validated reporting unit (activity or organisation report) plus the version declared by
 * its enclosing document.
 * <p><strong>Why:</strong> Statistic functions can assume a well-formed root once a {@code Record} exists.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param kind activity or organisation
 * @param element root element
 * @param documentVersion version attribute of the enclosing document; {@code null} when absent
 * @since 0.1.0
 */
public record Record(RecordKind kind, Node element, String documentVersion) {
  /** Deepest element nesting accepted for a record; published records nest about ten levels. */
  public static final int MAX_DEPTH = 512;

  public Record {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(element, "element");
  }

  /**
   * Validates the root element and wraps it.
   *
   * @param element candidate root element
   * @param documentVersion declared document version, may be {@code null}
   * @return validated record
   * @throws MalformedRecordException when the element is missing, is not a reporting unit root, or nests deeper
   *     than {@link #MAX_DEPTH}
   */
  public static Record of(Node element, String documentVersion) throws MalformedRecordException {
    if (element == null) {
      throw new MalformedRecordException("record element is missing");
    }
    RecordKind kind = RecordKind.forRootTag(element.tag());
    if (kind == null) {
      throw new MalformedRecordException("unexpected root element <" + element.tag() + ">");
    }
    checkDepth(element);
    return new Record(kind, element, documentVersion);
  }

  /** Walks the tree level by level so that the check itself cannot exhaust the stack. */
  private static void checkDepth(Node root) throws MalformedRecordException {
    List<Node> level = List.of(root);
    int depth = 1;
    while (!level.isEmpty()) {
      if (depth > MAX_DEPTH) {
        throw new MalformedRecordException("record nests deeper than " + MAX_DEPTH + " elements");
      }
      List<Node> next = new ArrayList<>();
      for (Node node : level) {
        next.addAll(node.children());
      }
      level = next;
      depth++;
    }
  }

  public boolean isActivity() {
    return kind == RecordKind.ACTIVITY;
  }

  /** Returns the trimmed identifier text, or {@code null} when the identifier element is absent. */
  public String identifier() {
    String tag = isActivity() ? "iati-identifier" : "organisation-identifier";
    Node id = element.child(tag);
    if (id == null && !isActivity()) {
      id = element.child("iati-identifier");
    }
    return id == null ? null : id.textOrEmpty().trim();
  }
}
