package org.codeforiati.stats.domain.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable element of a parsed record tree: tag, attributes, text and children.
 * <p><strong>Why:</strong> Statistic functions navigate records through a small, allocation-light API instead of
 * binding to an XML parser; parsing itself is performed by an external collaborator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across worker threads.</p>
 * <p><strong>Performance:</strong> Child lookups are linear scans; records are small relative to the corpus.</p>
 *
 * <p>Attribute keys are stored as they appear in the source markup, so the language attribute is keyed
 * {@code xml:lang}. Path expressions accepted by {@link #select(String)} and {@link #values(String)} use
 * {@code /} between tags, {@code *} for any child and a trailing {@code @name} for an attribute.</p>
 *
 * <p>A {@code null} child is a parser bug, not bad data, and is rejected at construction with
 * {@link NullPointerException}. Immutability rules out cycles.</p>
 *
 * @since 0.1.0
 */
public record Node(String tag, Map<String, String> attributes, String text, List<Node> children) {
  /** Attribute key carrying the narrative language. */
  public static final String XML_LANG = "xml:lang";

  public Node {
    tag = Objects.requireNonNull(tag, "tag");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static Builder builder(String tag) {
    return new Builder(tag);
  }

  /** Returns the attribute value or {@code null} when absent. */
  public String attribute(String name) {
    return attributes.get(name);
  }

  public boolean hasAttribute(String name) {
    return attributes.containsKey(name);
  }

  /** Returns the text content, never {@code null}. */
  public String textOrEmpty() {
    return text == null ? "" : text;
  }

  /** Returns the first child with the given tag, or {@code null}. */
  public Node child(String childTag) {
    for (Node child : children) {
      if (child.tag.equals(childTag)) {
        return child;
      }
    }
    return null;
  }

  /** Returns all children with the given tag in document order. */
  public List<Node> children(String childTag) {
    List<Node> out = new ArrayList<>();
    for (Node child : children) {
      if (child.tag.equals(childTag)) {
        out.add(child);
      }
    }
    return out;
  }

  /**
   * Selects descendant elements along a slash separated path, e.g. {@code transaction/value}.
   *
   * @param path relative element path; {@code *} matches any tag
   * @return matching elements in document order; empty when none match
   */
  public List<Node> select(String path) {
    List<Node> current = List.of(this);
    for (String step : path.split("/")) {
      List<Node> next = new ArrayList<>();
      for (Node node : current) {
        for (Node child : node.children) {
          if (step.equals("*") || child.tag.equals(step)) {
            next.add(child);
          }
        }
      }
      current = next;
    }
    return current;
  }

  /** Returns the first element matching {@link #select(String)}, or {@code null}. */
  public Node first(String path) {
    List<Node> found = select(path);
    return found.isEmpty() ? null : found.get(0);
  }

  /**
   * Collects attribute values ({@code a/b/@attr}) or element texts ({@code a/b}) for a path.
   * Absent attributes are skipped; element texts are included even when empty.
   */
  public List<String> values(String path) {
    int at = path.lastIndexOf("/@");
    String attributeName;
    List<Node> nodes;
    if (path.startsWith("@")) {
      attributeName = path.substring(1);
      nodes = List.of(this);
    } else if (at >= 0) {
      attributeName = path.substring(at + 2);
      nodes = select(path.substring(0, at));
    } else {
      attributeName = null;
      nodes = select(path);
    }
    List<String> out = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      if (attributeName == null) {
        out.add(node.textOrEmpty());
      } else if (node.attributes.containsKey(attributeName)) {
        out.add(node.attributes.get(attributeName));
      }
    }
    return out;
  }

  /** Returns the first value of {@link #values(String)} or {@code null}. */
  public String firstValue(String path) {
    List<String> found = values(path);
    return found.isEmpty() ? null : found.get(0);
  }

  /** Whether at least one element or attribute matches the path. */
  public boolean has(String path) {
    return !values(path).isEmpty();
  }

  /** Fluent builder used by parsers and tests. */
  public static final class Builder {
    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String text;

    private Builder(String tag) {
      this.tag = Objects.requireNonNull(tag, "tag");
    }

    public Builder attribute(String name, String value) {
      Objects.requireNonNull(name, "name");
      if (value != null) {
        attributes.put(name, value);
      }
      return this;
    }

    public Builder text(String value) {
      this.text = value;
      return this;
    }

    public Builder child(Node child) {
      children.add(Objects.requireNonNull(child, "child"));
      return this;
    }

    public Builder child(Builder child) {
      children.add(child.build());
      return this;
    }

    public Node build() {
      return new Node(tag, attributes, text, children);
    }
  }
}
