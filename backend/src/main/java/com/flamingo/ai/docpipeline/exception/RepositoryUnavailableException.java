package com.flamingo.ai.docpipeline.exception;

import java.util.UUID;

/**
 * Exception thrown when the document store cannot be reached.
 *
 * <p>Unlike the other pipeline failures this one is never turned into a FAILED status, because the
 * status write itself cannot be guaranteed. It is surfaced to the caller instead.
 */
public class RepositoryUnavailableException extends RuntimeException {

  private final UUID documentId;

  public RepositoryUnavailableException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return "Document store is temporarily unavailable. Please try again later.";
  }
}
