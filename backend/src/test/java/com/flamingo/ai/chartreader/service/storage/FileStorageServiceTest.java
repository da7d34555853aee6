package com.flamingo.ai.chartreader.service.storage;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStorageServiceTest {

  @TempDir Path tempDir;

  private FileStorageService storage;
  private Path newDir;
  private Path completedDir;

  @BeforeEach
  void setUp() {
    ChartReaderConfig config = new ChartReaderConfig();
    config.getStorage().setFilesDir(tempDir.toString());
    storage = new FileStorageService(config);
    storage.ensureDirectories();
    newDir = tempDir.resolve("new");
    completedDir = tempDir.resolve("completed");
  }

  @Test
  void shouldCreateDirectories() {
    assertThat(newDir).isDirectory();
    assertThat(completedDir).isDirectory();
    assertThat(tempDir.resolve("state")).isDirectory();
  }

  @Test
  void shouldLocateFile_inNewBeforeCompleted() throws Exception {
    save("2024-01-05_chart.png");
    Files.write(completedDir.resolve("2024-01-05_chart.png"), new byte[] {9});

    Optional<StoredFile> found = storage.locate("2024-01-05_chart.png");

    assertThat(found).isPresent();
    assertThat(found.get().location()).isEqualTo(FileLocation.NEW);
    assertThat(storage.locate("missing.png")).isEmpty();
  }

  @Test
  void shouldMoveToCompleted_withFreeName() throws Exception {
    save("2024-01-05_chart.png");
    Files.write(completedDir.resolve("2024-01-05_chart.png"), new byte[] {9});

    String finalName =
        storage.moveToCompleted("2024-01-05_chart.png", "2024-01-05_chart_1.png"::equals);

    assertThat(finalName).isEqualTo("2024-01-05_chart_2.png");
    assertThat(completedDir.resolve(finalName)).exists();
    assertThat(newDir.resolve("2024-01-05_chart.png")).doesNotExist();
  }

  @Test
  void shouldDeleteFromBothDirectories() throws Exception {
    save("2024-01-05_chart.png");
    Files.write(completedDir.resolve("2024-01-05_chart.png"), new byte[] {9});

    assertThat(storage.deleteEverywhere("2024-01-05_chart.png")).isTrue();
    assertThat(storage.existsInNew("2024-01-05_chart.png")).isFalse();
    assertThat(storage.existsInCompleted("2024-01-05_chart.png")).isFalse();
    assertThat(storage.deleteEverywhere("2024-01-05_chart.png")).isFalse();
  }

  @Test
  void shouldListSupportedDocuments_sorted() throws Exception {
    save("2024-01-12_b.pdf");
    save("2024-01-05_a.png");
    save("notes.txt");

    assertThat(storage.listNewDocuments()).containsExactly("2024-01-05_a.png", "2024-01-12_b.pdf");
  }

  private void save(String name) throws Exception {
    storage.saveToNew(name, new ByteArrayInputStream(new byte[] {1, 2, 3}));
  }
}
