package com.flamingo.ai.docpipeline.service.document;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.docpipeline.exception.DocumentProcessingException.Reason;
import com.flamingo.ai.docpipeline.exception.RepositoryUnavailableException;
import com.flamingo.ai.docpipeline.service.processing.DocumentProcessingService;
import com.flamingo.ai.docpipeline.service.processing.DocumentStatusView;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import com.flamingo.ai.docpipeline.storage.StoredObjectMetadata;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
  static final String DEFAULT_FILE_NAME = "document";

  private final DocumentStateStore stateStore;
  private final StorageBackend storageBackend;
  private final DocumentProcessingService documentProcessingService;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.upload", description = "Time to upload a document")
  public UUID submit(byte[] bytes, String fileName, String contentType) {
    validate(bytes, fileName);
    String name = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
    String type = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
    UUID documentId = UUID.randomUUID();
    log.info("Uploading document {} ({}, {} bytes) as {}", name, type, bytes.length, documentId);

    // Bytes first, so the record never points at a missing locator
    String locator =
        storageBackend.put(documentId, bytes, new StoredObjectMetadata(name, type, bytes.length));

    Document document =
        Document.builder()
            .id(documentId)
            .fileName(name)
            .contentType(type)
            .sizeBytes(bytes.length)
            .storageLocator(locator)
            .build();
    try {
      stateStore.create(document);
    } catch (RepositoryUnavailableException e) {
      log.warn("Stored bytes at {} have no document record: {}", locator, e.getMessage());
      throw e;
    }
    meterRegistry.counter("document.uploaded", "type", getFileType(type)).increment();

    if (pipelineConfig.getProcessing().isAutoStart()) {
      scheduleProcessing(documentId);
    }
    log.info("Document {} uploaded with ID: {}", name, documentId);
    return documentId;
  }

  @Override
  public Document upload(MultipartFile file) {
    final byte[] fileBytes;
    try {
      fileBytes = file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read file bytes: {}", e.getMessage());
      throw new DocumentProcessingException(
          Reason.UNREADABLE,
          file.getOriginalFilename(),
          "Failed to read upload: " + e.getMessage(),
          e);
    }
    UUID documentId = submit(fileBytes, file.getOriginalFilename(), file.getContentType());
    return stateStore.load(documentId);
  }

  @Override
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(UUID documentId) {
    return stateStore.load(documentId);
  }

  @Override
  public DocumentStatusView getStatus(UUID documentId) {
    return DocumentStatusView.from(stateStore.load(documentId));
  }

  @Override
  public List<Document> listActive() {
    return stateStore.listActive();
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(UUID documentId) {
    stateStore.load(documentId);
    stateStore.apply(documentId, Document::markDeleted);
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document: {}", documentId);
  }

  /** Starts async processing once the surrounding transaction, if any, has committed. */
  private void scheduleProcessing(UUID documentId) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug(
                  "Transaction committed, starting async processing for document: {}", documentId);
              documentProcessingService.processDocumentAsync(documentId);
            }
          });
    } else {
      log.debug("No active transaction, starting async processing for document: {}", documentId);
      documentProcessingService.processDocumentAsync(documentId);
    }
  }

  private void validate(byte[] bytes, String fileName) {
    if (bytes == null || bytes.length == 0) {
      throw new DocumentProcessingException(
          Reason.EMPTY, fileName, "File is empty", "Please upload a valid file");
    }
    long maxBytes = pipelineConfig.getUpload().getMaxBytes();
    if (bytes.length > maxBytes) {
      throw new DocumentProcessingException(
          Reason.TOO_LARGE,
          fileName,
          "File too large: " + bytes.length,
          "Maximum file size is " + (maxBytes / (1024 * 1024)) + "MB");
    }
  }

  private String getFileType(String contentType) {
    return switch (contentType.toLowerCase()) {
      case "application/pdf" -> "pdf";
      case "application/vnd.openxmlformats-officedocument.wordprocessingml.document" -> "docx";
      case "application/epub+zip" -> "epub";
      case "text/plain" -> "txt";
      case "text/markdown" -> "md";
      default -> "other";
    };
  }
}
