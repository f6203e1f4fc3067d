package ca.gc.cra.strata.infrastructure.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLogWriterTest {

  @TempDir
  Path tempDir;

  @Test
  void createsParentDirectoriesAndAppendsLines() throws IOException {
    Path file = tempDir.resolve("nested/dir/app.log");
    FileLogWriter writer = new FileLogWriter(file);

    writer.write(List.of("one", "two"));
    writer.write(List.of("three"));

    assertEquals(List.of("one", "two", "three"), Files.readAllLines(file, StandardCharsets.UTF_8));
    writer.close();
  }

  @Test
  void fileIsNotCreatedUntilFirstWrite() throws IOException {
    Path file = tempDir.resolve("lazy.log");
    FileLogWriter writer = new FileLogWriter(file);

    assertFalse(Files.exists(file));
    writer.close();
    assertFalse(Files.exists(file));
  }

  @Test
  void appendsToExistingFile() throws IOException {
    Path file = tempDir.resolve("existing.log");
    Files.writeString(file, "earlier\n");

    try (FileLogWriter writer = new FileLogWriter(file)) {
      writer.write(List.of("later"));
    }

    assertEquals(List.of("earlier", "later"), Files.readAllLines(file));
  }

  @Test
  void writeAfterCloseFails() throws IOException {
    FileLogWriter writer = new FileLogWriter(tempDir.resolve("closed.log"));
    writer.close();

    assertThrows(IOException.class, () -> writer.write(List.of("x")));
  }

  @Test
  void nullWriterCountsDiscardedLines() {
    NullLogWriter writer = new NullLogWriter();

    writer.write(List.of("a", "b"));

    assertEquals(2, writer.discardedLines());
  }
}
