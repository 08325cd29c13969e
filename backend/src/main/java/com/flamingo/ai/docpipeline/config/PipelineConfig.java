package com.flamingo.ai.docpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the document pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
@Validated
public class PipelineConfig {

  @Valid private Storage storage = new Storage();
  @Valid private Upload upload = new Upload();
  @Valid private Summarization summarization = new Summarization();
  @Valid private Processing processing = new Processing();

  /** Which backend holds uploaded bytes. */
  public enum StorageType {
    /** S3 when a bucket is configured, local disk otherwise. */
    AUTO,
    LOCAL,
    S3
  }

  @Getter
  @Setter
  public static class Storage {
    @NotNull private StorageType type = StorageType.AUTO;
    @Valid private Local local = new Local();
    private S3 s3 = new S3();
  }

  @Getter
  @Setter
  public static class Local {
    @NotBlank private String rootDir = "./data/documents";
  }

  @Getter
  @Setter
  public static class S3 {
    private String bucket;
    @NotBlank private String region = "us-east-1";

    /** Optional endpoint override (S3-compatible stores such as MinIO). */
    private String endpoint;

    private String accessKey;
    private String secretKey;
    private boolean pathStyleAccess = false;
  }

  @Getter
  @Setter
  public static class Upload {
    /** Max 50MB. */
    @Positive private long maxBytes = 50L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Summarization {
    /** Model variant used when the caller does not pick one. */
    @NotBlank private String modelId = "gpt-4o-mini";

    @Positive private int maxTokens = 1024;
    @NotNull private Duration timeout = Duration.ofSeconds(30);

    /** Model calls allowed in flight at once. */
    @Positive private int concurrency = 4;

    /** Longest input, in characters, sent to the model. */
    @Positive private int maxInputChars = 48_000;
  }

  @Getter
  @Setter
  public static class Processing {
    /** Start processing automatically once an upload commits. */
    private boolean autoStart = true;

    /** Threads running uploads' background processing. */
    @Positive private int workerThreads = 2;

    /** Uploads waiting for a worker before new ones are rejected. */
    @Positive private int queueCapacity = 100;

    /** Documents left in PROCESSING longer than this are considered abandoned. */
    @NotNull private Duration staleThreshold = Duration.ofMinutes(15);
  }
}
