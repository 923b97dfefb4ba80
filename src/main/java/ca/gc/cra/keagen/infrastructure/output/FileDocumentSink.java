package ca.gc.cra.keagen.infrastructure.output;

import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import ca.gc.cra.keagen.validation.Paths;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the rendered document to a JSON file, replacing it atomically where the filesystem allows.
 *
 * <p>On POSIX filesystems a replaced file keeps its permissions and a new file is created {@code rw-r--r--}, so
 * a Kea daemon running as another user can still read it.</p>
 *
 * @since 0.1.0
 */
public final class FileDocumentSink implements DocumentSink {
  private static final Logger log = LoggerFactory.getLogger(FileDocumentSink.class);
  private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

  private final Path target;
  private final KeaJsonWriter writer;
  private final boolean allowOverwrite;

  /**
   * Creates a file sink.
   *
   * @param target destination file; parent directories are created on first write
   * @param writer JSON serializer
   * @param allowOverwrite whether an existing file may be replaced
   */
  public FileDocumentSink(Path target, KeaJsonWriter writer, boolean allowOverwrite) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
    this.writer = Objects.requireNonNull(writer, "writer");
    this.allowOverwrite = allowOverwrite;
  }

  /**
   * Serializes {@code document} to a temporary sibling file and moves it over the target.
   *
   * @param document complete document
   * @throws IOException if the directory cannot be created or the file cannot be written or moved
   * @throws IllegalArgumentException if the target exists and overwriting was not allowed
   */
  @Override
  public void write(Map<String, Object> document) throws IOException {
    Objects.requireNonNull(document, "document");
    Path validated = Paths.validateOutputFile(target, allowOverwrite);
    Path directory = validated.getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, validated.getFileName().toString(), ".tmp");
    try {
      try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        writer.write(document, out);
        out.write('\n');
      }
      applyPermissions(temp, validated);
      move(temp, validated);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Wrote Kea configuration to {}", validated);
  }

  @Override
  public String describe() {
    return target.toString();
  }

  /**
   * Gives the temporary file the target's permissions, or {@link #NEW_FILE_PERMISSIONS} for a new target.
   * Applied after creation; the process umask would otherwise strip bits.
   */
  private static void applyPermissions(Path temp, Path target) throws IOException {
    if (!temp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
      return;
    }
    Set<PosixFilePermission> permissions = Files.exists(target, LinkOption.NOFOLLOW_LINKS)
        ? Files.getPosixFilePermissions(target)
        : NEW_FILE_PERMISSIONS;
    Files.setPosixFilePermissions(temp, permissions);
  }

  private static void move(Path source, Path destination) throws IOException {
    try {
      Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", destination);
      Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
