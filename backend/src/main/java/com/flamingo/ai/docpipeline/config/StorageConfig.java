package com.flamingo.ai.docpipeline.config;

import com.flamingo.ai.docpipeline.storage.LocalFileStorageBackend;
import com.flamingo.ai.docpipeline.storage.S3StorageBackend;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import java.net.URI;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/** Selects the document storage backend once at startup. */
@Configuration
@Slf4j
public class StorageConfig {

  @Bean
  public StorageBackend storageBackend(PipelineConfig pipelineConfig) {
    PipelineConfig.Storage storage = pipelineConfig.getStorage();
    PipelineConfig.StorageType type = resolveType(storage);
    log.info("Using '{}' document storage (configured type: {})", type, storage.getType());
    if (type == PipelineConfig.StorageType.S3) {
      PipelineConfig.S3 s3 = storage.getS3();
      return new S3StorageBackend(s3Client(s3), s3.getBucket());
    }
    return new LocalFileStorageBackend(Path.of(storage.getLocal().getRootDir()));
  }

  static PipelineConfig.StorageType resolveType(PipelineConfig.Storage storage) {
    String bucket = storage.getS3().getBucket();
    boolean bucketConfigured = bucket != null && !bucket.isBlank();
    return switch (storage.getType()) {
      case LOCAL -> PipelineConfig.StorageType.LOCAL;
      case S3 -> {
        if (!bucketConfigured) {
          throw new IllegalStateException(
              "pipeline.storage.type is s3 but pipeline.storage.s3.bucket is not set");
        }
        yield PipelineConfig.StorageType.S3;
      }
      case AUTO -> bucketConfigured
          ? PipelineConfig.StorageType.S3
          : PipelineConfig.StorageType.LOCAL;
    };
  }

  private S3Client s3Client(PipelineConfig.S3 s3) {
    S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(s3.getRegion()))
            .credentialsProvider(credentialsProvider(s3))
            .forcePathStyle(s3.isPathStyleAccess());
    if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
      builder.endpointOverride(URI.create(s3.getEndpoint()));
    }
    return builder.build();
  }

  private AwsCredentialsProvider credentialsProvider(PipelineConfig.S3 s3) {
    if (s3.getAccessKey() != null
        && !s3.getAccessKey().isBlank()
        && s3.getSecretKey() != null
        && !s3.getSecretKey().isBlank()) {
      log.info("Using static AWS credentials for S3 storage");
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey()));
    }
    log.info("Using default AWS credentials provider chain for S3 storage");
    return DefaultCredentialsProvider.create();
  }
}
