package com.flamingo.ai.docpipeline.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docpipeline.storage.LocalFileStorageBackend;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageConfigTest {

  @TempDir Path tempDir;

  @Test
  void shouldPickLocal_whenAutoAndNoBucket() {
    PipelineConfig.Storage storage = new PipelineConfig.Storage();

    assertThat(StorageConfig.resolveType(storage)).isEqualTo(PipelineConfig.StorageType.LOCAL);
  }

  @Test
  void shouldPickS3_whenAutoAndBucketConfigured() {
    PipelineConfig.Storage storage = new PipelineConfig.Storage();
    storage.getS3().setBucket("docs");

    assertThat(StorageConfig.resolveType(storage)).isEqualTo(PipelineConfig.StorageType.S3);
  }

  @Test
  void shouldHonourExplicitLocal_evenWithBucket() {
    PipelineConfig.Storage storage = new PipelineConfig.Storage();
    storage.setType(PipelineConfig.StorageType.LOCAL);
    storage.getS3().setBucket("docs");

    assertThat(StorageConfig.resolveType(storage)).isEqualTo(PipelineConfig.StorageType.LOCAL);
  }

  @Test
  void shouldFailFast_whenS3WithoutBucket() {
    PipelineConfig.Storage storage = new PipelineConfig.Storage();
    storage.setType(PipelineConfig.StorageType.S3);

    assertThatThrownBy(() -> StorageConfig.resolveType(storage))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bucket");
  }

  @Test
  void shouldBuildLocalBackend() {
    PipelineConfig config = new PipelineConfig();
    config.getStorage().getLocal().setRootDir(tempDir.toString());

    StorageBackend backend = new StorageConfig().storageBackend(config);

    assertThat(backend).isInstanceOf(LocalFileStorageBackend.class);
    assertThat(backend.name()).isEqualTo("local");
  }
}
