package com.flamingo.ai.docpipeline.service.document;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.service.processing.DocumentStatusView;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service for uploading and querying documents. */
public interface DocumentService {

  /**
   * Stores a document's bytes, records it as PENDING and schedules processing.
   *
   * @return the new document's id
   */
  UUID submit(byte[] bytes, String fileName, String contentType);

  /** Uploads a multipart file; see {@link #submit}. */
  Document upload(MultipartFile file);

  Document getDocument(UUID documentId);

  DocumentStatusView getStatus(UUID documentId);

  /** Lists documents that have not been deleted, newest first. */
  List<Document> listActive();

  /** Soft-deletes a document. Its bytes and record are kept. */
  void deleteDocument(UUID documentId);
}
