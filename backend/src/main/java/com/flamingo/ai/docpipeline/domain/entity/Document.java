package com.flamingo.ai.docpipeline.domain.entity;

import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import com.flamingo.ai.docpipeline.exception.InvalidStatusTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Represents an uploaded document and the outcome of processing it.
 *
 * <p>Status changes go through {@link #transitionTo(DocumentStatus)}, which rejects any move the
 * lifecycle does not allow. The mutators keep two invariants: a summary is present exactly when
 * the document is {@link DocumentStatus#PROCESSED}, and an error message is present exactly when
 * it is {@link DocumentStatus#FAILED}.
 */
@Entity
@Table(
    name = "documents",
    indexes = {@Index(name = "idx_documents_status", columnList = "status, deleted")})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  /** Assigned by the upload path before the bytes are stored, so storage is keyed by it. */
  @Id private UUID id;

  @Column(nullable = false, updatable = false)
  private String fileName;

  @Column(nullable = false, updatable = false)
  private String contentType;

  @Column(nullable = false, updatable = false)
  private long sizeBytes;

  @Column(nullable = false, updatable = false)
  private String storageLocator;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  @Column(columnDefinition = "TEXT")
  private String extractedText;

  /** LLM-generated summary of the extracted text. */
  @Column(columnDefinition = "TEXT")
  private String summary;

  /** Model variant that produced the summary. */
  private String summaryModel;

  /** Whether the extracted text was cut down to fit the model input window. */
  private Boolean summaryTruncated;

  /** Number of characters actually sent to the model. */
  private Integer summarizedChars;

  /** Error message if processing failed. */
  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Enumerated(EnumType.STRING)
  private FailureCode failureCode;

  @Builder.Default private int attempts = 0;

  @Builder.Default private boolean deleted = false;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @Version private Long version;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (updatedAt == null) {
      updatedAt = now;
    }
  }

  /**
   * Moves the document into {@link DocumentStatus#PROCESSING} for a fresh attempt. Results of any
   * previous attempt are cleared so nothing stale survives a retry.
   */
  public void startProcessing() {
    transitionTo(DocumentStatus.PROCESSING);
    this.extractedText = null;
    this.summary = null;
    this.summaryModel = null;
    this.summaryTruncated = null;
    this.summarizedChars = null;
    this.errorMessage = null;
    this.failureCode = null;
    this.attempts++;
  }

  /** Records extracted text while the document is still being processed. */
  public void recordExtractedText(String text) {
    transitionTo(DocumentStatus.PROCESSING);
    this.extractedText = text;
  }

  /** Marks the document as successfully processed. */
  public void markProcessed(String summary, String model, boolean truncated, int charsSent) {
    if (summary == null || summary.isBlank()) {
      throw new IllegalArgumentException("A processed document requires a non-blank summary");
    }
    transitionTo(DocumentStatus.PROCESSED);
    this.summary = summary;
    this.summaryModel = model;
    this.summaryTruncated = truncated;
    this.summarizedChars = charsSent;
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(FailureCode code, String message) {
    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("A failed document requires a non-blank error message");
    }
    transitionTo(DocumentStatus.FAILED);
    this.failureCode = code;
    this.errorMessage = message;
  }

  /** Soft-deletes the document; it disappears from active queries but is never purged. */
  public void markDeleted() {
    this.deleted = true;
    this.updatedAt = LocalDateTime.now();
  }

  /**
   * Applies a status transition, refreshing {@code updatedAt}.
   *
   * @throws InvalidStatusTransitionException if the lifecycle does not allow the move
   */
  public void transitionTo(DocumentStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStatusTransitionException(id, status, target);
    }
    this.status = target;
    this.updatedAt = LocalDateTime.now();
  }
}
