package ca.gc.cra.keagen.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges generator settings from defaults, YAML, and CLI sources while enforcing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective settings map using precedence CLI > YAML > defaults.
   *
   * <p>Keys keep the position of their first appearance, so subnets and options declared in YAML stay ahead of
   * those added on the command line.</p>
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return unmodifiable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Collections.unmodifiableMap(merged);
  }

  private static void validate(Map<String, String> effective) {
    String out = trim(effective.get("out"));
    boolean allowOverwrite = Boolean.parseBoolean(trim(effective.get("allowOverwrite")));
    if (out.isEmpty() && allowOverwrite) {
      throw new IllegalArgumentException("allowOverwrite requires out=PATH");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
