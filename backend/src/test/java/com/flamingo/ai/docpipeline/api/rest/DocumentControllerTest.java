package com.flamingo.ai.docpipeline.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import com.flamingo.ai.docpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.docpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.docpipeline.exception.GlobalExceptionHandler;
import com.flamingo.ai.docpipeline.exception.InvalidStatusTransitionException;
import com.flamingo.ai.docpipeline.exception.RepositoryUnavailableException;
import com.flamingo.ai.docpipeline.exception.StorageException;
import com.flamingo.ai.docpipeline.service.document.DocumentService;
import com.flamingo.ai.docpipeline.service.processing.DocumentProcessingService;
import com.flamingo.ai.docpipeline.service.processing.DocumentStatusView;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  @Mock private DocumentService documentService;
  @Mock private DocumentProcessingService documentProcessingService;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;
  private UUID documentId;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    DocumentController controller =
        new DocumentController(documentService, documentProcessingService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    documentId = UUID.randomUUID();
  }

  private Document pendingDocument() {
    return Document.builder()
        .id(documentId)
        .fileName("report.pdf")
        .contentType("application/pdf")
        .sizeBytes(1024)
        .storageLocator("documents/" + documentId + "/report.pdf")
        .build();
  }

  @Test
  @DisplayName("Should return 201 with a PENDING document after upload")
  void shouldUploadDocument() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[] {1, 2, 3});
    when(documentService.upload(any())).thenReturn(pendingDocument());

    mockMvc
        .perform(multipart("/api/documents").file(file))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(documentId.toString()))
        .andExpect(jsonPath("$.fileName").value("report.pdf"))
        .andExpect(jsonPath("$.status").value("PENDING"));
  }

  @Test
  @DisplayName("Should return 400 when the file part is missing")
  void shouldRejectUpload_whenFilePartMissing() throws Exception {
    mockMvc
        .perform(multipart("/api/documents"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should return 422 when the upload is rejected")
  void shouldReturnUnprocessable_whenUploadRejected() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);
    when(documentService.upload(any()))
        .thenThrow(
            new DocumentProcessingException(
                DocumentProcessingException.Reason.EMPTY,
                "empty.pdf",
                "File is empty",
                "Please upload a valid file"));

    mockMvc
        .perform(multipart("/api/documents").file(file))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message").value("Please upload a valid file"));
  }

  @Test
  @DisplayName("Should return 503 when storage is unavailable")
  void shouldReturnServiceUnavailable_whenStorageDown() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[] {1});
    when(documentService.upload(any()))
        .thenThrow(StorageException.unavailable("documents/x", new RuntimeException("down")));

    mockMvc
        .perform(multipart("/api/documents").file(file))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORAGE_001"));
  }

  @Test
  @DisplayName("Should list active documents")
  void shouldListDocuments() throws Exception {
    when(documentService.listActive()).thenReturn(List.of(pendingDocument()));

    mockMvc
        .perform(get("/api/documents"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(documentId.toString()));
  }

  @Test
  @DisplayName("Should return 404 for an unknown document")
  void shouldReturnNotFound_whenDocumentMissing() throws Exception {
    when(documentService.getDocument(documentId))
        .thenThrow(new DocumentNotFoundException(documentId));

    mockMvc
        .perform(get("/api/documents/{documentId}", documentId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("DOCUMENT_001"))
        .andExpect(jsonPath("$.errorId").exists());
  }

  @Test
  @DisplayName("Should return 400 for a malformed document id")
  void shouldReturnBadRequest_whenIdMalformed() throws Exception {
    mockMvc
        .perform(get("/api/documents/{documentId}", "not-a-uuid"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should expose failure details in the status view")
  void shouldReturnStatusView() throws Exception {
    Document document = pendingDocument();
    document.startProcessing();
    document.markFailed(FailureCode.SUMMARIZER_RATE_LIMITED, "Rate limited by summarizer");
    when(documentService.getStatus(documentId)).thenReturn(DocumentStatusView.from(document));

    mockMvc
        .perform(get("/api/documents/{documentId}/status", documentId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.failureCode").value("SUMMARIZER_RATE_LIMITED"))
        .andExpect(jsonPath("$.retryable").value(true))
        .andExpect(jsonPath("$.attempts").value(1));
  }

  @Test
  @DisplayName("Should process a pending document synchronously")
  void shouldProcessDocument() throws Exception {
    Document document = pendingDocument();
    document.startProcessing();
    document.markProcessed("A short summary.", "test-model", false, 120);
    when(documentProcessingService.processDocument(documentId))
        .thenReturn(DocumentStatusView.from(document));

    mockMvc
        .perform(post("/api/documents/{documentId}/process", documentId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PROCESSED"))
        .andExpect(jsonPath("$.summary").value("A short summary."));
  }

  @Test
  @DisplayName("Should return 409 when retrying a pending document")
  void shouldReturnConflict_whenRetryNotAllowed() throws Exception {
    when(documentProcessingService.retry(documentId))
        .thenThrow(
            new InvalidStatusTransitionException(
                documentId, DocumentStatus.PENDING, DocumentStatus.PROCESSING));

    mockMvc
        .perform(post("/api/documents/{documentId}/retry", documentId))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"))
        .andExpect(jsonPath("$.message").value("Document cannot be processed from status PENDING"));
  }

  @Test
  @DisplayName("Should return 503 when the document store is unavailable")
  void shouldReturnServiceUnavailable_whenRepositoryDown() throws Exception {
    when(documentProcessingService.retry(documentId))
        .thenThrow(
            new RepositoryUnavailableException(documentId, "locked", new RuntimeException()));

    mockMvc
        .perform(post("/api/documents/{documentId}/retry", documentId))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("REPOSITORY_001"));
  }

  @Test
  @DisplayName("Should soft-delete a document")
  void shouldDeleteDocument() throws Exception {
    mockMvc
        .perform(delete("/api/documents/{documentId}", documentId))
        .andExpect(status().isNoContent());

    verify(documentService).deleteDocument(documentId);
  }

  @Test
  @DisplayName("Should return 404 when deleting an unknown document")
  void shouldReturnNotFound_whenDeletingMissingDocument() throws Exception {
    doThrow(new DocumentNotFoundException(documentId))
        .when(documentService)
        .deleteDocument(documentId);

    mockMvc
        .perform(delete("/api/documents/{documentId}", documentId))
        .andExpect(status().isNotFound());
  }
}
