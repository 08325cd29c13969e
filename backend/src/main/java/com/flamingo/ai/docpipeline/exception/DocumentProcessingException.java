package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when an upload is rejected before it enters the pipeline. */
public class DocumentProcessingException extends RuntimeException {

  /** Why the upload was turned away. */
  public enum Reason {
    EMPTY,
    TOO_LARGE,
    UNREADABLE
  }

  private final Reason reason;
  private final String fileName;
  private final String userMessage;

  public DocumentProcessingException(
      Reason reason, String fileName, String message, String userMessage) {
    super(message);
    this.reason = reason;
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public DocumentProcessingException(
      Reason reason, String fileName, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.fileName = fileName;
    this.userMessage = "The uploaded file could not be read";
  }

  public Reason getReason() {
    return reason;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
