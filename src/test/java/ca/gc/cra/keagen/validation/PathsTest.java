package ca.gc.cra.keagen.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void acceptsNewFileUnderMissingDirectory() {
    Path target = tempDir.resolve("a/b/kea.conf");

    assertEquals(target.toAbsolutePath().normalize(), Paths.validateOutputFile(target, false));
  }

  @Test
  void existingFileNeedsOverwrite() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("kea.conf"), "{}");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(existing, false));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateOutputFile(existing, true));
  }

  @Test
  void rejectsDirectoriesAndFileParents() throws IOException {
    Path file = Files.writeString(tempDir.resolve("plain"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(file.resolve("kea.conf"), true));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(null, true));
  }
}
