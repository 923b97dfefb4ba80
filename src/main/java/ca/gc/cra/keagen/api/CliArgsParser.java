package ca.gc.cra.keagen.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments such as {@code subnets.lan.cidr=10.0.0.0/24} into an ordered map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * <p>Argument order is preserved so subnets and options keep their command-line order. A repeated key keeps
   * its first position and its last value.</p>
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable ordered map
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
  }
}
