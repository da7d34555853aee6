package com.flamingo.ai.chartreader.service.storage;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Manages the {@code new/} and {@code completed/} document directories.
 *
 * <p>Uploads land in {@code new/}; a successful run moves the file to {@code completed/} under a
 * name that collides with neither the directory nor another job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileStorageService {

  private final ChartReaderConfig config;

  public void ensureDirectories() {
    ChartReaderConfig.Storage storage = config.getStorage();
    try {
      Files.createDirectories(storage.newDir());
      Files.createDirectories(storage.completedDir());
      Files.createDirectories(storage.stateDir());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create storage directories", e);
    }
  }

  /** Looks for the file in {@code new/} first, then {@code completed/}. */
  public Optional<StoredFile> locate(String filename) {
    Path inNew = config.getStorage().newDir().resolve(filename);
    if (Files.isRegularFile(inNew)) {
      return Optional.of(new StoredFile(inNew, FileLocation.NEW));
    }
    Path inCompleted = config.getStorage().completedDir().resolve(filename);
    if (Files.isRegularFile(inCompleted)) {
      return Optional.of(new StoredFile(inCompleted, FileLocation.COMPLETED));
    }
    return Optional.empty();
  }

  public boolean existsInNew(String filename) {
    return Files.exists(config.getStorage().newDir().resolve(filename));
  }

  public boolean existsInCompleted(String filename) {
    return Files.exists(config.getStorage().completedDir().resolve(filename));
  }

  /** Writes an upload into {@code new/} under the given, already unique, name. */
  public Path saveToNew(String filename, InputStream content) throws IOException {
    Path target = config.getStorage().newDir().resolve(filename);
    Files.createDirectories(target.getParent());
    Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
    log.debug("Stored upload {}", target);
    return target;
  }

  /**
   * Moves a file from {@code new/} into {@code completed/}.
   *
   * @param isTakenElsewhere whether another job already claims a candidate name
   * @return the final file name in {@code completed/}
   */
  public String moveToCompleted(String filename, Predicate<String> isTakenElsewhere)
      throws IOException {
    Path source = config.getStorage().newDir().resolve(filename);
    String finalName =
        FileNames.makeUnique(
            filename, name -> existsInCompleted(name) || isTakenElsewhere.test(name));
    Path target = config.getStorage().completedDir().resolve(finalName);
    Files.createDirectories(target.getParent());
    move(source, target);
    return finalName;
  }

  /** Removes the file from both directories; returns whether anything was deleted. */
  public boolean deleteEverywhere(String filename) {
    boolean deleted = false;
    for (Path dir : List.of(config.getStorage().newDir(), config.getStorage().completedDir())) {
      Path candidate = dir.resolve(filename);
      try {
        deleted |= Files.deleteIfExists(candidate);
      } catch (IOException e) {
        log.warn("Failed to delete {}: {}", candidate, e.getMessage());
      }
    }
    return deleted;
  }

  /** Supported documents in {@code new/}, sorted by name. */
  public List<String> listNewDocuments() {
    Path dir = config.getStorage().newDir();
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(FileNames::isSupported)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }

  /** Rename, falling back to copy and delete when the directories are on different stores. */
  static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic move not supported for {}, copying instead", source);
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
      Files.deleteIfExists(source);
    }
  }
}
