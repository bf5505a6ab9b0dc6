package org.codeforiati.stats.domain.reference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.codeforiati.stats.domain.record.Node;

/**
 * <strong>What:</strong> Where a codelist is used: an element path, an optional condition on the element and the
 * attribute carrying the code, as published in the standard's codelist mapping files.
 * <p><strong>Key:</strong> {@link #key()} renders the mapping as a descendant path with the condition in
 * brackets, e.g. {@code .//sector[@vocabulary = '2']/@code}. Reports use that key verbatim.</p>
 * <p><strong>Conditions:</strong> alternatives joined by {@code or}, each either {@code @name = 'value'} or
 * {@code not(@name)}. Other XPath is rejected when the mapping is created.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class CodelistMapping {
  private static final Pattern EQUALS = Pattern.compile("@([\\w:-]+)\\s*=\\s*'([^']*)'");
  private static final Pattern ABSENT = Pattern.compile("not\\(\\s*@([\\w:-]+)\\s*\\)");
  private static final Pattern OR = Pattern.compile("\\s+or\\s+");

  private final String key;
  private final List<String> steps;
  private final String attribute;
  private final List<Alternative> condition;

  private CodelistMapping(String key, List<String> steps, String attribute, List<Alternative> condition) {
    this.key = key;
    this.steps = steps;
    this.attribute = attribute;
    this.condition = condition;
  }

  /**
   * Parses a mapping entry.
   *
   * @param path absolute path such as {@code //iati-activity/sector/@code}
   * @param condition XPath predicate on the element holding the attribute; may be {@code null}
   * @return parsed mapping
   * @throws IllegalArgumentException when the path is not absolute or the condition is not supported
   */
  public static CodelistMapping of(String path, String condition) {
    Objects.requireNonNull(path, "path");
    if (!path.startsWith("//")) {
      throw new IllegalArgumentException("codelist path must start with //: " + path);
    }
    String relative = path.startsWith("//iati-activity")
        ? "./" + path.substring("//iati-activity".length())
        : "." + path;
    String body = relative.substring(".//".length());
    List<String> steps = new ArrayList<>(List.of(body.split("/")));
    String attribute = null;
    if (!steps.isEmpty() && steps.get(steps.size() - 1).startsWith("@")) {
      attribute = steps.remove(steps.size() - 1).substring(1);
    }
    if (steps.stream().anyMatch(String::isEmpty) || (steps.isEmpty() && attribute == null)) {
      throw new IllegalArgumentException("unsupported codelist path: " + path);
    }
    List<Alternative> alternatives = parseCondition(condition);
    String key = relative;
    if (condition != null) {
      int split = relative.lastIndexOf('/');
      key = relative.substring(0, split) + "[" + condition + "]" + relative.substring(split);
    }
    return new CodelistMapping(key, List.copyOf(steps), attribute, alternatives);
  }

  private static List<Alternative> parseCondition(String condition) {
    if (condition == null) {
      return List.of();
    }
    List<Alternative> out = new ArrayList<>();
    for (String part : OR.split(condition.trim())) {
      Matcher equals = EQUALS.matcher(part.trim());
      Matcher absent = ABSENT.matcher(part.trim());
      if (equals.matches()) {
        out.add(new Alternative(equals.group(1), equals.group(2)));
      } else if (absent.matches()) {
        out.add(new Alternative(absent.group(1), null));
      } else {
        throw new IllegalArgumentException("unsupported codelist condition: " + condition);
      }
    }
    return List.copyOf(out);
  }

  /** Report key, e.g. {@code .//transaction/transaction-type/@code}. */
  public String key() {
    return key;
  }

  /**
   * Collects the coded values this mapping selects within a record, searching the root and all its descendants
   * for the first step.
   *
   * @param root record root element
   * @return values in document order; attribute values for attribute paths, element texts otherwise
   */
  public List<String> values(Node root) {
    List<Node> anchors = new ArrayList<>();
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(root);
    String first = steps.isEmpty() ? null : steps.get(0);
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      if (first == null || first.equals("*") || node.tag().equals(first)) {
        anchors.add(node);
      }
      List<Node> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    List<String> out = new ArrayList<>();
    for (Node anchor : anchors) {
      List<Node> targets = steps.size() > 1 ? anchor.select(String.join("/", steps.subList(1, steps.size())))
          : List.of(anchor);
      for (Node target : targets) {
        if (!matches(target)) {
          continue;
        }
        if (attribute == null) {
          out.add(target.textOrEmpty());
        } else if (target.hasAttribute(attribute)) {
          out.add(target.attribute(attribute));
        }
      }
    }
    return out;
  }

  private boolean matches(Node element) {
    if (condition.isEmpty()) {
      return true;
    }
    for (Alternative alternative : condition) {
      String actual = element.attribute(alternative.attribute());
      if (alternative.value() == null ? actual == null : alternative.value().equals(actual)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return key;
  }

  /** {@code @attribute = 'value'}, or {@code not(@attribute)} when {@code value} is {@code null}. */
  private record Alternative(String attribute, String value) {}
}
