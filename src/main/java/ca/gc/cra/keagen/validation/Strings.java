package ca.gc.cra.keagen.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for generator configuration and CLI values.
 * <p><strong>Why:</strong> Interface names, subnet labels and option names end up as JSON keys or values read by
 * Kea; control characters and blanks are rejected before the model is built.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character input.</li>
 *   <li>Restrict configuration labels to {@code [A-Za-z0-9._-]}.</li>
 *   <li>Split comma separated lists into trimmed, non-blank items.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a configuration label such as a subnet key or option name.
   *
   * @param name parameter name for diagnostics
   * @param label candidate label
   * @return trimmed label matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the label is blank or uses other characters
   */
  public static String requireLabel(String name, String label) {
    String sanitized = requireNonBlank(name, label);
    if (!LABEL_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Splits a comma separated list.
   *
   * @param name parameter name for diagnostics
   * @param value list text such as {@code "eth0, eth1"}; {@code null} or blank yields an empty list
   * @return trimmed items in input order
   * @throws IllegalArgumentException if an item is blank or contains control characters
   */
  public static List<String> splitList(String name, String value) {
    List<String> items = new ArrayList<>();
    if (value == null || value.isBlank()) {
      return items;
    }
    for (String token : value.split(",", -1)) {
      items.add(requireNonBlank(name, token));
    }
    return items;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
