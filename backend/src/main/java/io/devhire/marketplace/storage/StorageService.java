package io.devhire.marketplace.storage;

/**
 * Abstraction for blob storage of solution archives. Domain services inject this interface instead
 * of vendor-specific clients (e.g., S3Client).
 *
 * <p>System-wide: selected via {@code storage.provider}.
 */
public interface StorageService {

  /**
   * Stores the bytes under the given key and returns the handle to persist.
   *
   * @throws StorageException if the write did not complete
   */
  String upload(String key, byte[] content, String contentType);

  /**
   * Reads the bytes stored under the key.
   *
   * @throws io.devhire.marketplace.exception.ResourceNotFoundException if no blob exists
   */
  byte[] download(String key);

  /** Delete a blob. Best-effort -- logs warning on failure. */
  void delete(String key);
}
