package com.flamingo.ai.docpipeline.service.processing;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import java.time.LocalDateTime;
import java.util.UUID;

/** Snapshot of a document's processing state. */
public record DocumentStatusView(
    UUID id,
    String fileName,
    DocumentStatus status,
    String summary,
    String errorMessage,
    FailureCode failureCode,
    boolean retryable,
    int attempts,
    LocalDateTime updatedAt) {

  public static DocumentStatusView from(Document document) {
    return new DocumentStatusView(
        document.getId(),
        document.getFileName(),
        document.getStatus(),
        document.getSummary(),
        document.getErrorMessage(),
        document.getFailureCode(),
        document.getStatus().isTerminal(),
        document.getAttempts(),
        document.getUpdatedAt());
  }
}
