package com.flamingo.ai.docpipeline.service.processing;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.service.summarization.SummarizationOptions;
import java.time.Duration;

/**
 * Immutable processing settings, resolved once at startup.
 *
 * @param summarization options passed on every summarization call
 * @param staleThreshold how long a document may sit in PROCESSING before it is declared abandoned
 */
public record ProcessingSettings(SummarizationOptions summarization, Duration staleThreshold) {

  public static ProcessingSettings from(PipelineConfig config) {
    PipelineConfig.Summarization summarization = config.getSummarization();
    return new ProcessingSettings(
        new SummarizationOptions(
            summarization.getMaxTokens(), summarization.getModelId(), summarization.getTimeout()),
        config.getProcessing().getStaleThreshold());
  }
}
