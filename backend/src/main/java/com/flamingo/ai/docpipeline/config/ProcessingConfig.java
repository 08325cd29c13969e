package com.flamingo.ai.docpipeline.config;

import com.flamingo.ai.docpipeline.service.processing.ProcessingSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Freezes the processing settings read from {@link PipelineConfig}. */
@Configuration
@Slf4j
public class ProcessingConfig {

  @Bean
  public ProcessingSettings processingSettings(PipelineConfig pipelineConfig) {
    ProcessingSettings settings = ProcessingSettings.from(pipelineConfig);
    log.info(
        "Summarization model={}, maxTokens={}, timeout={}",
        settings.summarization().modelId(),
        settings.summarization().maxTokens(),
        settings.summarization().timeout());
    return settings;
  }
}
