package io.devhire.marketplace.storage;

import java.util.UUID;
import java.util.regex.Pattern;

/** Builds and validates blob keys. Keys are opaque to callers but follow a fixed layout. */
public final class StorageKeys {

  private static final Pattern SOLUTION_KEY_PATTERN =
      Pattern.compile("^tasks/[0-9a-fA-F-]{36}/solutions/[0-9a-fA-F-]{36}$");

  /** A fresh key for a solution archive of the given task. */
  public static String solutionKey(UUID taskId) {
    return "tasks/" + taskId + "/solutions/" + UUID.randomUUID();
  }

  public static void validate(String key) {
    if (key == null || !SOLUTION_KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
  }

  private StorageKeys() {}
}
