package dev.lorekeeper.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalResourceFileStoreTest {

  @TempDir Path root;

  Path uploads;

  LocalResourceFileStore store;

  @BeforeEach
  void setUp() throws IOException {
    uploads = Files.createDirectory(root.resolve("uploads"));
    store = new LocalResourceFileStore(uploads);
  }

  @Test
  void resolvesStoredFileInsideUploadDirectory() throws IOException {
    Path collection = Files.createDirectory(uploads.resolve("campaign"));
    Path file = Files.writeString(collection.resolve("handbook.txt"), "Rules.");

    assertThat(store.resolve("campaign/handbook.txt")).isEqualTo(file.toAbsolutePath());
  }

  @Test
  void normalisesRedundantSegmentsThatStayInside() throws IOException {
    Path file = Files.writeString(uploads.resolve("handbook.txt"), "Rules.");

    assertThat(store.resolve("campaign/../handbook.txt")).isEqualTo(file.toAbsolutePath());
  }

  @Test
  void rejectsLocationOutsideUploadDirectory() throws IOException {
    Files.writeString(root.resolve("secrets.txt"), "nope");

    assertThatThrownBy(() -> store.resolve("../secrets.txt"))
        .isInstanceOf(ResourceFileNotFoundException.class)
        .hasMessageContaining("escapes upload directory");
  }

  @Test
  void rejectsMissingFile() {
    assertThatThrownBy(() -> store.resolve("campaign/missing.pdf"))
        .isInstanceOf(ResourceFileNotFoundException.class)
        .hasMessage("Uploaded file not found: campaign/missing.pdf");
  }

  @Test
  void rejectsDirectory() throws IOException {
    Files.createDirectory(uploads.resolve("campaign"));

    assertThatThrownBy(() -> store.resolve("campaign"))
        .isInstanceOf(ResourceFileNotFoundException.class);
  }
}
