package io.devhire.marketplace.storage.local;

import io.devhire.marketplace.config.StorageProperties;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.storage.StorageException;
import io.devhire.marketplace.storage.StorageKeys;
import io.devhire.marketplace.storage.StorageService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Filesystem implementation of {@link StorageService}. Each key maps to a file under {@code
 * storage.local.root-dir}. Writes go to a temporary sibling first and are moved into place, so a
 * reader never sees a partial archive.
 */
@Component
@EnableConfigurationProperties(StorageProperties.class)
@ConditionalOnProperty(name = "storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalStorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(LocalStorageAdapter.class);

  private final Path rootDir;

  public LocalStorageAdapter(StorageProperties storageProperties) {
    this.rootDir = Path.of(storageProperties.local().rootDir()).toAbsolutePath().normalize();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      try {
        Files.write(temp, content);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to write blob " + key, e);
    }
    log.debug("Stored blob {} ({} bytes)", key, content.length);
    return key;
  }

  @Override
  public byte[] download(String key) {
    Path source = resolve(key);
    try {
      return Files.readAllBytes(source);
    } catch (NoSuchFileException e) {
      throw ResourceNotFoundException.withDetail("Blob not found", "No blob stored at " + key);
    } catch (IOException e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageException("Failed to read blob " + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (Exception e) {
      log.warn("Best-effort local deletion failed for key={}: {}", key, e.getMessage());
    }
  }

  private Path resolve(String key) {
    StorageKeys.validate(key);
    Path path = rootDir.resolve(key).normalize();
    if (!path.startsWith(rootDir)) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
    return path;
  }
}
