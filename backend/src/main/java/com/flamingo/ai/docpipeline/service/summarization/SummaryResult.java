package com.flamingo.ai.docpipeline.service.summarization;

/**
 * Outcome of a successful summarization call.
 *
 * @param summary non-blank summary text
 * @param modelId model variant that produced it
 * @param truncated whether the input was cut to fit the model input window
 * @param charsSent characters of input actually sent
 * @param originalChars characters of input before truncation
 */
public record SummaryResult(
    String summary, String modelId, boolean truncated, int charsSent, int originalChars) {}
