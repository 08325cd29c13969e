package com.flamingo.ai.docpipeline.storage;

import com.flamingo.ai.docpipeline.exception.StorageException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link StorageBackend} on an S3 bucket. Locators are object keys.
 *
 * <p>Missing keys map to {@code NOT_FOUND}; every other SDK failure (network, throttling, access
 * denied) maps to {@code BACKEND_UNAVAILABLE}.
 */
@Slf4j
public class S3StorageBackend implements StorageBackend, AutoCloseable {

  private static final int HTTP_NOT_FOUND = 404;

  private final S3Client s3Client;
  private final String bucketName;

  public S3StorageBackend(S3Client s3Client, String bucketName) {
    this.s3Client = s3Client;
    this.bucketName = bucketName;
    log.info("S3 document storage initialized for bucket '{}'", bucketName);
  }

  @Override
  public String put(UUID documentId, byte[] bytes, StoredObjectMetadata metadata) {
    String key = StorageLocators.forDocument(documentId, metadata.fileName());
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(metadata.contentType())
            .contentLength((long) bytes.length)
            .metadata(
                Map.of(
                    "document-id", documentId.toString(),
                    "file-name", URLEncoder.encode(metadata.fileName(), StandardCharsets.UTF_8)))
            .build();
    try {
      s3Client.putObject(request, RequestBody.fromBytes(bytes));
      log.info("Uploaded {} bytes to S3 key: {}", bytes.length, key);
      return key;
    } catch (SdkException e) {
      log.error("Failed to upload document {} to S3 key {}: {}", documentId, key, e.getMessage());
      throw StorageException.unavailable(key, e);
    }
  }

  @Override
  public byte[] get(String locator) {
    log.debug("Downloading object from S3 key: {}", locator);
    GetObjectRequest request = GetObjectRequest.builder().bucket(bucketName).key(locator).build();
    try {
      return s3Client.getObjectAsBytes(request).asByteArray();
    } catch (NoSuchKeyException e) {
      throw StorageException.notFound(locator);
    } catch (S3Exception e) {
      if (e.statusCode() == HTTP_NOT_FOUND) {
        throw StorageException.notFound(locator);
      }
      throw StorageException.unavailable(locator, e);
    } catch (SdkException e) {
      log.error("Failed to download S3 key {}: {}", locator, e.getMessage());
      throw StorageException.unavailable(locator, e);
    }
  }

  @Override
  public boolean exists(String locator) {
    HeadObjectRequest request = HeadObjectRequest.builder().bucket(bucketName).key(locator).build();
    try {
      s3Client.headObject(request);
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == HTTP_NOT_FOUND) {
        return false;
      }
      throw StorageException.unavailable(locator, e);
    } catch (SdkException e) {
      throw StorageException.unavailable(locator, e);
    }
  }

  @Override
  public String name() {
    return "s3";
  }

  @Override
  public void close() {
    s3Client.close();
  }
}
