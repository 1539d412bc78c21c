package io.devhire.marketplace.storage;

/** The blob store could not complete a read or write. */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
