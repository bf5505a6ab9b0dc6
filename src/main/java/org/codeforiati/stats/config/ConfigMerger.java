package org.codeforiati.stats.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges engine settings with precedence overrides &gt; YAML &gt; defaults and validates the result.
 */
public final class ConfigMerger {
  private ConfigMerger() {}

  /**
   * Builds the effective flat configuration.
   *
   * @param section YAML section the settings came from, used in messages
   * @param yaml settings loaded by {@link YamlConfigLoader}, if any
   * @param overrides programmatic or command-line overrides; may be {@code null}
   * @param defaults baseline settings, normally {@link EngineDefaults#asFlatMap()}
   * @param warn receives a message whenever an override replaces a YAML value; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when the merged settings do not form a valid {@link EngineConfig}
   */
  public static Map<String, String> buildEffectiveConfig(
      String section,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> fromYaml = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(fromYaml);
    if (overrides != null) {
      overrides.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (fromYaml.containsKey(key) && warn != null) {
          warn.accept("Override replaces " + section + " YAML value for key: " + key);
        }
        merged.put(key, value);
      });
    }
    try {
      EngineConfig.fromMap(merged);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid " + section + " configuration: " + ex.getMessage(), ex);
    }
    return Map.copyOf(merged);
  }
}
