package com.flamingo.ai.docpipeline.service.summarization;

/** Client for the remote model that summarizes extracted document text. */
public interface SummarizationClient {

  /**
   * Summarizes a document's text. One remote call per invocation; no internal retries.
   *
   * @param text extracted text, non-blank
   * @param options model, length cap and timeout for this call
   * @return the summary and what was sent to produce it
   * @throws com.flamingo.ai.docpipeline.exception.SummarizationException on remote failure
   * @throws com.flamingo.ai.docpipeline.exception.ProcessingCancelledException if the calling
   *     thread is interrupted while waiting
   */
  SummaryResult summarize(String text, SummarizationOptions options);
}
