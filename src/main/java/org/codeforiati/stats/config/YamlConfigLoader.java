package org.codeforiati.stats.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads engine settings from a YAML document.
 *
 * <p>The {@code common} section is applied first and the named section second, so a key in the named section
 * wins. Nested mappings become dotted keys; lists are rejected.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads and flattens {@code common} plus {@code section}.
   *
   * @param path YAML file
   * @param section section name, matched case-insensitively, e.g. {@code engine}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or not a mapping of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "document");
    Map<String, String> flat = new LinkedHashMap<>();
    String wanted = section.trim().toLowerCase(Locale.ROOT);
    sectionNamed(root, COMMON).ifPresent(common -> flatten(mapping(common, COMMON), "", flat));
    if (!wanted.equals(COMMON)) {
      sectionNamed(root, wanted).ifPresent(named -> flatten(mapping(named, wanted), "", flat));
    }
    return Optional.of(Map.copyOf(flat));
  }

  private static Optional<Object> sectionNamed(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name) && entry.getValue() != null) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key");
      }
      out.put(name, value);
    });
    return out;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Lists are not supported for key " + dotted);
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
