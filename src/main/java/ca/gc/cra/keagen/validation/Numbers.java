package ca.gc.cra.keagen.validation;

/**
 * <strong>What:</strong> Numeric parsing and range checks for generator configuration values.
 * <p><strong>Why:</strong> Lease lifetimes arrive as text from YAML or {@code key=value} arguments and must be
 * rejected with a readable message before the domain model is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  /** Largest lifetime Kea accepts: an unsigned 32-bit number of seconds. */
  public static final long MAX_UINT32 = 0xFFFF_FFFFL;

  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name for diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank, not a number, or out of range
   */
  public static long parseLong(String name, String raw, long min, long max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + trimmed + "')", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Parses {@code true} or {@code false}, ignoring case.
   *
   * <p>Unlike {@link Boolean#parseBoolean(String)}, any other text is rejected.</p>
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse
   * @return parsed flag
   * @throws IllegalArgumentException if {@code raw} is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException(label(name) + " must be true or false (was '" + trimmed + "')");
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
