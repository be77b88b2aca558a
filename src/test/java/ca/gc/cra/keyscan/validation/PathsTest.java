package ca.gc.cra.keyscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void parseReturnsAbsoluteNormalizedPath() {
    Path parsed = Paths.parse("in", "dumps/../core.bin");

    assertTrue(parsed.isAbsolute());
    assertEquals(Path.of("core.bin").toAbsolutePath().normalize(), parsed);
  }

  @Test
  void parseRejectsBlankText() {
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("in", " "));
  }

  @Test
  void requireReadableFileAcceptsRegularFile() throws IOException {
    Path file = Files.write(tempDir.resolve("core.bin"), new byte[] {1});

    assertEquals(file, Paths.requireReadableFile(file));
  }

  @Test
  void requireReadableFileRejectsMissingFilesAndDirectories() {
    assertThrows(NoSuchFileException.class, () -> Paths.requireReadableFile(tempDir.resolve("absent.bin")));
    assertThrows(NoSuchFileException.class, () -> Paths.requireReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(null));
  }
}
