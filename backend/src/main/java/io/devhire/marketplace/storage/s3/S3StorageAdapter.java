package io.devhire.marketplace.storage.s3;

import io.devhire.marketplace.config.S3Config.S3Properties;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.storage.StorageException;
import io.devhire.marketplace.storage.StorageKeys;
import io.devhire.marketplace.storage.StorageService;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3")
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final S3Client s3Client;
  private final String bucketName;

  public S3StorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    StorageKeys.validate(key);
    var putRequest =
        PutObjectRequest.builder().bucket(bucketName).key(key).contentType(contentType).build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    } catch (SdkException e) {
      throw new StorageException("Failed to upload object to storage", e);
    }
    return key;
  }

  @Override
  public byte[] download(String key) {
    StorageKeys.validate(key);
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();
    try (var response = s3Client.getObject(getRequest)) {
      return response.readAllBytes();
    } catch (NoSuchKeyException e) {
      throw ResourceNotFoundException.withDetail("Blob not found", "No blob stored at " + key);
    } catch (SdkException | IOException e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageException("Failed to download object from storage", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
    } catch (Exception e) {
      log.warn("Best-effort S3 deletion failed for key={}: {}", key, e.getMessage());
    }
  }
}
