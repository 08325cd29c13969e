package com.flamingo.ai.docpipeline.storage;

import com.flamingo.ai.docpipeline.exception.StorageException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link StorageBackend} on the local filesystem.
 *
 * <p>Locators are paths relative to the root directory. Writes go to a temporary file in the target
 * directory and are then moved into place, so readers never observe a partially written document.
 */
@Slf4j
public class LocalFileStorageBackend implements StorageBackend {

  private final Path root;

  public LocalFileStorageBackend(Path root) {
    this.root = root.toAbsolutePath().normalize();
    log.info("Local document storage rooted at {}", this.root);
  }

  @Override
  public String put(UUID documentId, byte[] bytes, StoredObjectMetadata metadata) {
    String locator = StorageLocators.forDocument(documentId, metadata.fileName());
    Path target = resolve(locator);
    Path tempFile = null;
    try {
      Files.createDirectories(target.getParent());
      tempFile = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(tempFile, bytes);
      moveIntoPlace(tempFile, target);
      tempFile = null;
      log.debug("Stored {} bytes at {}", bytes.length, locator);
      return locator;
    } catch (IOException e) {
      log.error("Failed to store document {} at {}: {}", documentId, locator, e.getMessage());
      throw StorageException.unavailable(locator, e);
    } finally {
      if (tempFile != null) {
        try {
          Files.deleteIfExists(tempFile);
        } catch (IOException e) {
          log.warn("Failed to delete temporary file {}: {}", tempFile, e.getMessage());
        }
      }
    }
  }

  @Override
  public byte[] get(String locator) {
    Path path = resolve(locator);
    ensureRootReachable(locator);
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      throw StorageException.notFound(locator);
    } catch (IOException e) {
      log.error("Failed to read {}: {}", locator, e.getMessage());
      throw StorageException.unavailable(locator, e);
    }
  }

  @Override
  public boolean exists(String locator) {
    Path path = resolve(locator);
    ensureRootReachable(locator);
    return Files.isRegularFile(path);
  }

  @Override
  public String name() {
    return "local";
  }

  public Path getRoot() {
    return root;
  }

  private void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void ensureRootReachable(String locator) {
    if (!Files.isDirectory(root)) {
      throw StorageException.unavailable(
          locator, new NoSuchFileException(root.toString(), null, "storage root is missing"));
    }
  }

  /** Resolves a locator under the root; locators escaping the root are unknown by definition. */
  private Path resolve(String locator) {
    if (locator == null || locator.isBlank()) {
      throw StorageException.notFound(String.valueOf(locator));
    }
    Path resolved = root.resolve(locator).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw StorageException.notFound(locator);
    }
    return resolved;
  }
}
