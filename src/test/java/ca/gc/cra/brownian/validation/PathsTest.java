package ca.gc.cra.brownian.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void existingOutputRequiresOverwriteApproval() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("paths.csv"), "x");

    ConfigurationException ex = assertThrows(
        ConfigurationException.class, () -> Paths.validateWritableFile(existing, true, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));

    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateWritableFile(existing, true, true));
  }

  @Test
  void missingParentsAreCreatedOnlyWhenRequested() {
    Path nested = tempDir.resolve("a/b/paths.csv");

    Paths.validateWritableFile(nested, false, false);
    assertTrue(Files.notExists(tempDir.resolve("a")));

    Paths.validateWritableFile(nested, true, false);
    assertTrue(Files.isDirectory(tempDir.resolve("a/b")));
  }

  @Test
  void directoryIsNotAValidOutputFile() {
    assertThrows(ConfigurationException.class, () -> Paths.validateWritableFile(tempDir, true, true));
  }

  @Test
  void readableFileMustExist() throws IOException {
    assertThrows(
        ConfigurationException.class, () -> Paths.requireReadableFile(tempDir.resolve("missing.csv")));
    assertThrows(ConfigurationException.class, () -> Paths.requireReadableFile(tempDir));

    Path file = Files.writeString(tempDir.resolve("in.csv"), "data");
    assertEquals(file.toRealPath(), Paths.requireReadableFile(file));
  }
}
