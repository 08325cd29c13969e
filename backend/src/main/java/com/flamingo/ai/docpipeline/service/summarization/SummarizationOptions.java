package com.flamingo.ai.docpipeline.service.summarization;

import java.time.Duration;

/**
 * Per-call summarization settings.
 *
 * @param maxTokens upper bound on the length of the generated summary
 * @param modelId model variant to use
 * @param timeout how long the caller waits before giving up on the remote model
 */
public record SummarizationOptions(int maxTokens, String modelId, Duration timeout) {

  public SummarizationOptions {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
    }
    if (modelId == null || modelId.isBlank()) {
      throw new IllegalArgumentException("modelId is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
  }
}
