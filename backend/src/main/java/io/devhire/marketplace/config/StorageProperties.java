package io.devhire.marketplace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Blob store selection.
 *
 * @param provider {@code local} (default) or {@code s3}
 * @param local settings for the filesystem store
 */
@ConfigurationProperties("storage")
public record StorageProperties(String provider, Local local) {

  public StorageProperties {
    if (provider == null || provider.isBlank()) {
      provider = "local";
    }
    if (local == null) {
      local = new Local(null);
    }
  }

  /** @param rootDir directory under which blob keys are resolved */
  public record Local(String rootDir) {

    public Local {
      if (rootDir == null || rootDir.isBlank()) {
        rootDir = "./data/solutions";
      }
    }
  }
}
