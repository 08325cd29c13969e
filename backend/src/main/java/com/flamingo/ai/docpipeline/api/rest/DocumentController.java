package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.api.dto.response.DocumentResponse;
import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.service.document.DocumentService;
import com.flamingo.ai.docpipeline.service.processing.DocumentProcessingService;
import com.flamingo.ai.docpipeline.service.processing.DocumentStatusView;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document management. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;
  private final DocumentProcessingService documentProcessingService;

  /** Uploads a document; processing starts in the background. */
  @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(@RequestParam("file") MultipartFile file) {
    Document document = documentService.upload(file);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Lists documents that have not been deleted. */
  @GetMapping("/documents")
  public ResponseEntity<List<DocumentResponse>> listDocuments() {
    List<DocumentResponse> responses =
        documentService.listActive().stream().map(DocumentResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a document by ID. */
  @GetMapping("/documents/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    Document document = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Gets the processing status of a document. */
  @GetMapping("/documents/{documentId}/status")
  public ResponseEntity<DocumentStatusView> getDocumentStatus(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentService.getStatus(documentId));
  }

  /** Processes a pending document synchronously. */
  @PostMapping("/documents/{documentId}/process")
  public ResponseEntity<DocumentStatusView> processDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentProcessingService.processDocument(documentId));
  }

  /** Re-runs processing for a failed or processed document. */
  @PostMapping("/documents/{documentId}/retry")
  public ResponseEntity<DocumentStatusView> retryDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentProcessingService.retry(documentId));
  }

  /** Soft-deletes a document. */
  @DeleteMapping("/documents/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }
}
