package com.flamingo.ai.docpipeline.api.dto.response;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. Extracted text is left out; it can be very large. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private String contentType;
  private Long sizeBytes;
  private DocumentStatus status;
  private String summary;
  private String summaryModel;
  private Boolean summaryTruncated;
  private String errorMessage;
  private FailureCode failureCode;
  private Boolean transientFailure;
  private Integer attempts;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .contentType(document.getContentType())
        .sizeBytes(document.getSizeBytes())
        .status(document.getStatus())
        .summary(document.getSummary())
        .summaryModel(document.getSummaryModel())
        .summaryTruncated(document.getSummaryTruncated())
        .errorMessage(document.getErrorMessage())
        .failureCode(document.getFailureCode())
        .transientFailure(
            document.getFailureCode() != null ? document.getFailureCode().isTransient() : null)
        .attempts(document.getAttempts())
        .createdAt(document.getCreatedAt())
        .updatedAt(document.getUpdatedAt())
        .build();
  }
}
