package io.devhire.marketplace.storage.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devhire.marketplace.config.StorageProperties;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.storage.StorageKeys;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalStorageAdapterTest {

  @TempDir Path rootDir;

  private LocalStorageAdapter storage;

  @BeforeEach
  void setUp() {
    storage =
        new LocalStorageAdapter(
            new StorageProperties("local", new StorageProperties.Local(rootDir.toString())));
  }

  @Test
  void upload_thenDownloadReturnsSameBytes() {
    String key = StorageKeys.solutionKey(UUID.randomUUID());

    String handle = storage.upload(key, new byte[] {1, 2, 3}, "application/zip");

    assertThat(handle).isEqualTo(key);
    assertThat(storage.download(handle)).containsExactly(1, 2, 3);
    assertThat(rootDir.resolve(key)).exists();
  }

  @Test
  void upload_leavesNoTemporaryFiles() throws Exception {
    String key = StorageKeys.solutionKey(UUID.randomUUID());

    storage.upload(key, new byte[] {9}, "application/zip");

    try (var files = Files.list(rootDir.resolve(key).getParent())) {
      assertThat(files).hasSize(1);
    }
  }

  @Test
  void download_missingKeyIsNotFound() {
    String key = StorageKeys.solutionKey(UUID.randomUUID());

    assertThatThrownBy(() -> storage.download(key)).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void delete_isBestEffort() {
    String key = StorageKeys.solutionKey(UUID.randomUUID());
    storage.upload(key, new byte[] {1}, "application/zip");

    storage.delete(key);

    assertThat(rootDir.resolve(key)).doesNotExist();
    assertThatCode(() -> storage.delete(key)).doesNotThrowAnyException();
  }

  @Test
  void upload_rejectsKeysOutsideSolutionLayout() {
    assertThatThrownBy(() -> storage.upload("../../etc/passwd", new byte[] {1}, "text/plain"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> storage.download("tasks/abc/solutions/def"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
