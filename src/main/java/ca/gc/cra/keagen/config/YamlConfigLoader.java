package ca.gc.cra.keagen.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads generator settings from a YAML document and flattens sections into dotted key/value maps.
 *
 * <p>Example:</p>
 * <pre>{@code
 * generate:
 *   lifetime: 7200
 *   interfaces: [enp0s1]
 *   subnets:
 *     lan:
 *       cidr: 192.168.50.0/24
 *       pools: [192.168.50.10-192.168.50.20]
 *   options:
 *     routers:
 *       data: 192.168.50.1
 * }</pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested section.
   *
   * @param path location of the YAML configuration
   * @param section section name, e.g. {@code generate}
   * @return flat map in document order, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedSection = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object namedSection = findSection(root, normalizedSection);
      if (namedSection instanceof Map<?, ?> sectionMap) {
        flatten(asMap(sectionMap, normalizedSection), "", flattened);
      }

      return Optional.of(Collections.unmodifiableMap(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists for key " + key + " must contain scalars only");
      }
      joined.add(item.toString());
    }
    return joined.toString();
  }
}
