package com.flamingo.ai.docpipeline.exception;

import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import java.util.UUID;

/** Exception thrown when a status change is not part of the document lifecycle. */
public class InvalidStatusTransitionException extends IllegalStateException {

  private final UUID documentId;
  private final DocumentStatus from;
  private final DocumentStatus to;

  public InvalidStatusTransitionException(UUID documentId, DocumentStatus from, DocumentStatus to) {
    super(String.format("Document %s cannot move from %s to %s", documentId, from, to));
    this.documentId = documentId;
    this.from = from;
    this.to = to;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public DocumentStatus getFrom() {
    return from;
  }

  public DocumentStatus getTo() {
    return to;
  }
}
