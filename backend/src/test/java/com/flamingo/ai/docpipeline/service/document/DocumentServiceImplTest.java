package com.flamingo.ai.docpipeline.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.docpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.docpipeline.exception.StorageException;
import com.flamingo.ai.docpipeline.service.processing.DocumentProcessingService;
import com.flamingo.ai.docpipeline.service.processing.DocumentStatusView;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import com.flamingo.ai.docpipeline.storage.StoredObjectMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
class DocumentServiceImplTest {

  @Mock private DocumentStateStore stateStore;
  @Mock private StorageBackend storageBackend;
  @Mock private DocumentProcessingService documentProcessingService;

  private PipelineConfig pipelineConfig;
  private SimpleMeterRegistry meterRegistry;
  private DocumentServiceImpl documentService;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    meterRegistry = new SimpleMeterRegistry();
    documentService =
        new DocumentServiceImpl(
            stateStore, storageBackend, documentProcessingService, pipelineConfig, meterRegistry);
  }

  @Test
  void shouldStoreBytesThenCreatePendingRecord_andScheduleProcessing() {
    // Given
    byte[] bytes = "PDF content".getBytes(StandardCharsets.UTF_8);
    when(storageBackend.put(any(UUID.class), eq(bytes), any(StoredObjectMetadata.class)))
        .thenAnswer(invocation -> "documents/" + invocation.getArgument(0) + "/test.pdf");
    when(stateStore.create(any(Document.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    // When
    UUID documentId = documentService.submit(bytes, "test.pdf", "application/pdf");

    // Then
    ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
    verify(stateStore).create(captor.capture());
    Document created = captor.getValue();
    assertThat(created.getId()).isEqualTo(documentId);
    assertThat(created.getStatus()).isEqualTo(DocumentStatus.PENDING);
    assertThat(created.getStorageLocator()).isEqualTo("documents/" + documentId + "/test.pdf");
    assertThat(created.getSizeBytes()).isEqualTo(bytes.length);
    verify(documentProcessingService).processDocumentAsync(documentId);
    assertThat(meterRegistry.counter("document.uploaded", "type", "pdf").count()).isEqualTo(1.0);
  }

  @Test
  void shouldAcceptUnknownContentType_andDefaultToOctetStream() {
    when(storageBackend.put(any(UUID.class), any(byte[].class), any(StoredObjectMetadata.class)))
        .thenReturn("documents/x/blob");
    when(stateStore.create(any(Document.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    documentService.submit(new byte[] {1, 2, 3}, null, null);

    ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
    verify(stateStore).create(captor.capture());
    assertThat(captor.getValue().getContentType()).isEqualTo("application/octet-stream");
    assertThat(captor.getValue().getFileName()).isEqualTo("document");
  }

  @Test
  void shouldNotScheduleProcessing_whenAutoStartDisabled() {
    pipelineConfig.getProcessing().setAutoStart(false);
    when(storageBackend.put(any(UUID.class), any(byte[].class), any(StoredObjectMetadata.class)))
        .thenReturn("documents/x/a.txt");
    when(stateStore.create(any(Document.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    documentService.submit("hi".getBytes(StandardCharsets.UTF_8), "a.txt", "text/plain");

    verifyNoInteractions(documentProcessingService);
  }

  @Test
  void shouldThrowException_whenFileIsEmpty() {
    assertThatThrownBy(() -> documentService.submit(new byte[0], "test.pdf", "application/pdf"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("empty")
        .extracting("reason")
        .isEqualTo(DocumentProcessingException.Reason.EMPTY);
    verifyNoInteractions(storageBackend, stateStore);
  }

  @Test
  void shouldThrowException_whenFileTooLarge() {
    pipelineConfig.getUpload().setMaxBytes(4);

    assertThatThrownBy(() -> documentService.submit(new byte[5], "big.pdf", "application/pdf"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("too large")
        .extracting("reason")
        .isEqualTo(DocumentProcessingException.Reason.TOO_LARGE);
    verifyNoInteractions(storageBackend, stateStore);
  }

  @Test
  void shouldNotCreateRecord_whenStorageFails() {
    when(storageBackend.put(any(UUID.class), any(byte[].class), any(StoredObjectMetadata.class)))
        .thenThrow(
            StorageException.unavailable("documents/x/a.txt", new RuntimeException("disk full")));

    assertThatThrownBy(() -> documentService.submit(new byte[] {1}, "a.txt", "text/plain"))
        .isInstanceOf(StorageException.class);
    verify(stateStore, never()).create(any());
    verifyNoInteractions(documentProcessingService);
  }

  @Test
  void shouldUploadMultipartFile() {
    MockMultipartFile file =
        new MockMultipartFile("file", "notes.txt", "text/plain", "some notes".getBytes());
    when(storageBackend.put(any(UUID.class), any(byte[].class), any(StoredObjectMetadata.class)))
        .thenReturn("documents/x/notes.txt");
    when(stateStore.create(any(Document.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(stateStore.load(any(UUID.class)))
        .thenAnswer(
            invocation ->
                Document.builder()
                    .id(invocation.getArgument(0))
                    .fileName("notes.txt")
                    .contentType("text/plain")
                    .build());

    Document result = documentService.upload(file);

    assertThat(result.getFileName()).isEqualTo("notes.txt");
    assertThat(result.getStatus()).isEqualTo(DocumentStatus.PENDING);
  }

  @Test
  void shouldReturnStatusView() {
    UUID id = UUID.randomUUID();
    Document document =
        Document.builder().id(id).fileName("a.txt").contentType("text/plain").build();
    when(stateStore.load(id)).thenReturn(document);

    DocumentStatusView view = documentService.getStatus(id);

    assertThat(view.id()).isEqualTo(id);
    assertThat(view.status()).isEqualTo(DocumentStatus.PENDING);
    assertThat(view.retryable()).isFalse();
  }

  @Test
  void shouldListActiveDocuments() {
    Document document = Document.builder().id(UUID.randomUUID()).fileName("a.txt").build();
    when(stateStore.listActive()).thenReturn(List.of(document));

    assertThat(documentService.listActive()).containsExactly(document);
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldSoftDeleteDocument() {
    UUID id = UUID.randomUUID();
    Document document = Document.builder().id(id).fileName("a.txt").build();
    when(stateStore.load(id)).thenReturn(document);

    documentService.deleteDocument(id);

    ArgumentCaptor<Consumer<Document>> mutation = ArgumentCaptor.forClass(Consumer.class);
    verify(stateStore).apply(eq(id), mutation.capture());
    mutation.getValue().accept(document);
    assertThat(document.isDeleted()).isTrue();
    assertThat(meterRegistry.counter("document.deleted").count()).isEqualTo(1.0);
  }

  @Test
  void shouldThrowNotFound_whenDeletingUnknownDocument() {
    UUID id = UUID.randomUUID();
    when(stateStore.load(id)).thenThrow(new DocumentNotFoundException(id));

    assertThatThrownBy(() -> documentService.deleteDocument(id))
        .isInstanceOf(DocumentNotFoundException.class);
    verify(stateStore, never()).apply(any(), any());
  }
}
