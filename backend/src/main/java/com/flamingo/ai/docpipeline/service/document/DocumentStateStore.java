package com.flamingo.ai.docpipeline.service.document;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.repository.DocumentRepository;
import com.flamingo.ai.docpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.docpipeline.exception.RepositoryUnavailableException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transactional access to {@link Document} records.
 *
 * <p>Every write runs in its own transaction and is flushed before returning, so a status change is
 * durable once the call completes. SQLite lock contention is retried a few times; any other
 * data-access failure is reported as {@link RepositoryUnavailableException}. Optimistic-lock
 * conflicts are passed through untouched so callers can tell a lost race from an outage.
 */
@Component
@Slf4j
public class DocumentStateStore {

  static final int MAX_RETRIES = 3;
  static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final TransactionTemplate transactionTemplate;

  public DocumentStateStore(
      DocumentRepository documentRepository, PlatformTransactionManager transactionManager) {
    this.documentRepository = documentRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Loads an active document.
   *
   * @throws DocumentNotFoundException if no such document exists or it was soft-deleted
   */
  public Document load(UUID documentId) {
    return read(
        documentId,
        () ->
            documentRepository
                .findById(documentId)
                .filter(document -> !document.isDeleted())
                .orElseThrow(() -> new DocumentNotFoundException(documentId)));
  }

  /** Lists documents that have not been soft-deleted, newest first. */
  public List<Document> listActive() {
    return read(null, documentRepository::findByDeletedFalseOrderByCreatedAtDesc);
  }

  /** Lists active documents that have sat in PROCESSING since before the cutoff. */
  public List<Document> findStuckProcessing(LocalDateTime cutoff) {
    return read(
        null,
        () ->
            documentRepository.findByStatusAndDeletedFalseAndUpdatedAtBefore(
                DocumentStatus.PROCESSING, cutoff));
  }

  public long countActive() {
    return read(null, documentRepository::countActive);
  }

  public long countByStatus(DocumentStatus status) {
    return read(null, () -> documentRepository.countByStatusAndDeletedFalse(status));
  }

  /** Persists a new document record. */
  public Document create(Document document) {
    return write(document.getId(), () -> documentRepository.saveAndFlush(document));
  }

  /**
   * Loads a document, applies a mutation and saves it in one transaction.
   *
   * <p>The lookup includes soft-deleted documents so an in-flight attempt can still record its
   * outcome.
   *
   * @throws DocumentNotFoundException if the document does not exist
   * @throws OptimisticLockingFailureException if another writer changed the document concurrently
   */
  public Document apply(UUID documentId, Consumer<Document> mutation) {
    return write(
        documentId,
        () -> {
          Document document =
              documentRepository
                  .findById(documentId)
                  .orElseThrow(() -> new DocumentNotFoundException(documentId));
          mutation.accept(document);
          return documentRepository.saveAndFlush(document);
        });
  }

  private <T> T read(UUID documentId, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      log.error("Document store read failed for {}: {}", documentId, e.getMessage());
      throw new RepositoryUnavailableException(
          documentId, "Document store read failed: " + e.getMessage(), e);
    }
  }

  /** Runs a write in its own transaction with retry logic for SQLite lock contention. */
  private <T> T write(UUID documentId, Supplier<T> operation) {
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionTemplate.execute(status -> operation.get());
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw new RepositoryUnavailableException(
              documentId, "Document store is locked: " + e.getMessage(), e);
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        sleepBeforeRetry(documentId, attempt);
      } catch (OptimisticLockingFailureException e) {
        throw e;
      } catch (DataAccessException | TransactionException e) {
        log.error("Document store write failed for {}: {}", documentId, e.getMessage());
        throw new RepositoryUnavailableException(
            documentId, "Document store write failed: " + e.getMessage(), e);
      }
    }
  }

  private void sleepBeforeRetry(UUID documentId, int attempt) {
    try {
      Thread.sleep(RETRY_DELAY_MS * attempt);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RepositoryUnavailableException(
          documentId, "Interrupted while waiting for the document store", ie);
    }
  }
}
