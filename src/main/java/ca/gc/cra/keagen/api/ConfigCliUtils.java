package ca.gc.cra.keagen.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the YAML path given as {@code config=PATH}.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Records a boolean CLI flag as a setting so it takes precedence over YAML.
   *
   * @param args mutable CLI map
   * @param present whether the flag was supplied
   * @param key setting key
   * @param value value to record when present
   */
  static void applyFlag(Map<String, String> args, boolean present, String key, boolean value) {
    if (present) {
      args.put(key, Boolean.toString(value));
    }
  }
}
