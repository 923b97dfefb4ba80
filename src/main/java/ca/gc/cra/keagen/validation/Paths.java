package ca.gc.cra.keagen.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for generated configuration files.
 * <p><strong>Why:</strong> Kea reads its configuration from a fixed path; an accidental overwrite of a live
 * configuration must be an explicit operator decision.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> No logs; callers surface {@link IllegalArgumentException} messages.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked target counts as existing.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a destination file for generated output.
   *
   * @param path candidate file; must not be {@code null}
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, names a directory, has a non-directory parent,
   *     or exists while {@code allowOverwrite} is {@code false}
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (normalized.getFileName() == null) {
      throw new IllegalArgumentException("path must name a file: " + path);
    }
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent != null && Files.exists(parent) && !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output file already exists (use --allow-overwrite to replace): " + normalized);
    }
    return normalized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
