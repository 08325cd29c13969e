package com.flamingo.ai.docpipeline.service.extraction;

/**
 * Turns raw document bytes into plain text.
 *
 * <p>Implementations are synchronous and stateless. They either return the full text or throw
 * {@link com.flamingo.ai.docpipeline.exception.ExtractionException}; partial results are never
 * returned.
 */
public interface TextExtractor {

  /**
   * Extracts text from a document.
   *
   * @param bytes raw document content
   * @param contentType normalized MIME type, without parameters
   * @return extracted text, possibly blank (the router rejects blank text)
   */
  String extract(byte[] bytes, String contentType);

  /** Returns {@code true} if this extractor handles the given normalized MIME type. */
  boolean supports(String contentType);
}
