package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when text cannot be extracted from a document. */
public class ExtractionException extends RuntimeException {

  /** Why extraction failed. */
  public enum Reason {
    /** No extractor handles the content type. */
    UNSUPPORTED_FORMAT,
    /** The byte stream could not be parsed. */
    CORRUPT_INPUT,
    /** Parsing succeeded but produced no text. */
    EMPTY_RESULT
  }

  private final Reason reason;
  private final String contentType;

  public ExtractionException(Reason reason, String contentType, String message) {
    super(message);
    this.reason = reason;
    this.contentType = contentType;
  }

  public ExtractionException(Reason reason, String contentType, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.contentType = contentType;
  }

  public static ExtractionException unsupportedFormat(String contentType) {
    return new ExtractionException(
        Reason.UNSUPPORTED_FORMAT,
        contentType,
        "Unsupported format: content type '" + contentType + "' cannot be text-extracted");
  }

  public static ExtractionException corruptInput(String contentType, Throwable cause) {
    return new ExtractionException(
        Reason.CORRUPT_INPUT,
        contentType,
        "Corrupt input: could not parse '" + contentType + "' document: " + cause.getMessage(),
        cause);
  }

  public static ExtractionException emptyResult(String contentType) {
    return new ExtractionException(
        Reason.EMPTY_RESULT,
        contentType,
        "Empty result: no text could be extracted from '" + contentType + "' document");
  }

  public Reason getReason() {
    return reason;
  }

  public String getContentType() {
    return contentType;
  }
}
