package com.flamingo.ai.docpipeline.service.processing;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import com.flamingo.ai.docpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.docpipeline.exception.ExtractionException;
import com.flamingo.ai.docpipeline.exception.InvalidStatusTransitionException;
import com.flamingo.ai.docpipeline.exception.ProcessingCancelledException;
import com.flamingo.ai.docpipeline.exception.RepositoryUnavailableException;
import com.flamingo.ai.docpipeline.exception.StorageException;
import com.flamingo.ai.docpipeline.exception.SummarizationException;
import com.flamingo.ai.docpipeline.service.document.DocumentStateStore;
import com.flamingo.ai.docpipeline.service.extraction.TextExtractorRouter;
import com.flamingo.ai.docpipeline.service.summarization.SummarizationClient;
import com.flamingo.ai.docpipeline.service.summarization.SummaryResult;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Orchestrates document processing: load bytes, extract text, summarize, persist.
 *
 * <p>Each invocation makes exactly one attempt. Storage, extraction and summarization failures end
 * the attempt in {@link DocumentStatus#FAILED} with a specific message and {@link FailureCode};
 * {@link RepositoryUnavailableException} aborts the attempt without a status write and is
 * rethrown, since that write could not be trusted anyway.
 *
 * <p>Only one attempt per document runs at a time in this process. A caller that loses the race,
 * or asks to process a document that is not eligible, gets the current state back and nothing is
 * written. Across processes the entity version column rejects the second writer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private static final Set<DocumentStatus> PROCESSABLE = EnumSet.of(DocumentStatus.PENDING);
  private static final Set<DocumentStatus> RETRYABLE =
      EnumSet.of(DocumentStatus.FAILED, DocumentStatus.PROCESSED);

  private final DocumentStateStore stateStore;
  private final StorageBackend storageBackend;
  private final TextExtractorRouter textExtractor;
  private final SummarizationClient summarizationClient;
  private final DocumentLockRegistry lockRegistry;
  private final ProcessingSettings settings;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a PENDING document. Documents in any other status are returned unchanged.
   *
   * @param documentId the document to process
   * @return the state after the attempt
   * @throws DocumentNotFoundException if the document does not exist or was deleted
   * @throws RepositoryUnavailableException if the document store cannot be reached
   */
  @Timed(value = "document.process", description = "Time to process document")
  public DocumentStatusView processDocument(UUID documentId) {
    return runExclusive(documentId, PROCESSABLE, false);
  }

  /**
   * Re-runs extraction and summarization from scratch for a FAILED or PROCESSED document.
   *
   * @throws InvalidStatusTransitionException if the document is PENDING, or PROCESSING with no
   *     attempt running in this process
   */
  @Timed(value = "document.retry", description = "Time to retry document processing")
  public DocumentStatusView retry(UUID documentId) {
    log.info("Retry requested for document {}", documentId);
    meterRegistry.counter("document.processing.retry").increment();
    return runExclusive(documentId, RETRYABLE, true);
  }

  /** Processes a document on the {@code documentProcessingExecutor}. */
  @Async("documentProcessingExecutor")
  @Timed(value = "document.process", description = "Time to process document")
  public void processDocumentAsync(UUID documentId) {
    try {
      processDocument(documentId);
    } catch (DocumentNotFoundException e) {
      log.warn("Document {} disappeared before processing started", documentId);
    } catch (RepositoryUnavailableException e) {
      log.error(
          "Document {} left unprocessed, document store unavailable: {}",
          documentId,
          e.getMessage());
    }
  }

  private DocumentStatusView runExclusive(
      UUID documentId, Set<DocumentStatus> eligible, boolean explicitRetry) {
    if (!lockRegistry.tryLock(documentId)) {
      log.info("Document {} is already being processed, returning current state", documentId);
      meterRegistry.counter("document.processing.skipped", "reason", "in_flight").increment();
      return DocumentStatusView.from(stateStore.load(documentId));
    }
    try {
      Document document = stateStore.load(documentId);
      if (!eligible.contains(document.getStatus())) {
        if (explicitRetry) {
          throw new InvalidStatusTransitionException(
              documentId, document.getStatus(), DocumentStatus.PROCESSING);
        }
        log.debug("Document {} is {}, nothing to do", documentId, document.getStatus());
        meterRegistry.counter("document.processing.skipped", "reason", "not_eligible").increment();
        return DocumentStatusView.from(document);
      }
      return runAttempt(documentId);
    } finally {
      lockRegistry.unlock(documentId);
    }
  }

  private DocumentStatusView runAttempt(UUID documentId) {
    Document document;
    try {
      document = stateStore.apply(documentId, Document::startProcessing);
    } catch (OptimisticLockingFailureException e) {
      log.info("Document {} was claimed by another worker", documentId);
      return DocumentStatusView.from(stateStore.load(documentId));
    }
    log.info(
        "Processing document {} ({}, attempt {})",
        documentId,
        document.getContentType(),
        document.getAttempts());

    try {
      byte[] bytes = storageBackend.get(document.getStorageLocator());
      checkCancelled("storage read");

      String text = textExtractor.extract(bytes, document.getContentType());
      checkCancelled("extraction");
      stateStore.apply(documentId, d -> d.recordExtractedText(text));
      log.debug("Document {} extracted {} chars", documentId, text.length());

      SummaryResult result = summarizationClient.summarize(text, settings.summarization());
      Document processed =
          stateStore.apply(
              documentId,
              d ->
                  d.markProcessed(
                      result.summary(), result.modelId(), result.truncated(), result.charsSent()));

      meterRegistry.counter("document.processing.success").increment();
      log.info(
          "Successfully processed document {} ({} char summary{})",
          documentId,
          result.summary().length(),
          result.truncated() ? ", input truncated" : "");
      return DocumentStatusView.from(processed);

    } catch (RepositoryUnavailableException e) {
      log.error("Aborting attempt for document {}: {}", documentId, e.getMessage());
      throw e;
    } catch (OptimisticLockingFailureException e) {
      log.warn("Document {} was changed by another writer mid-attempt", documentId);
      return DocumentStatusView.from(stateStore.load(documentId));
    } catch (ProcessingCancelledException e) {
      return failCancelled(documentId, e);
    } catch (StorageException e) {
      log.warn("Storage read failed for document {} at {}", documentId, e.getLocator());
      return fail(documentId, failureCodeFor(e), e.getMessage());
    } catch (ExtractionException e) {
      log.warn("Extraction failed for document {} as {}", documentId, e.getContentType());
      return fail(documentId, failureCodeFor(e), e.getMessage());
    } catch (SummarizationException e) {
      return fail(documentId, failureCodeFor(e), e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error processing document {}", documentId, e);
      return fail(documentId, FailureCode.INTERNAL_ERROR, "Unexpected error: " + e.getMessage());
    }
  }

  private DocumentStatusView fail(UUID documentId, FailureCode code, String message) {
    log.error("Failed to process document {} [{}]: {}", documentId, code, message);
    meterRegistry
        .counter("document.processing.failure", "failure_code", code.name().toLowerCase())
        .increment();
    Document failed = stateStore.apply(documentId, d -> d.markFailed(code, message));
    return DocumentStatusView.from(failed);
  }

  /** Records the cancellation with the interrupt flag cleared, then restores it. */
  private DocumentStatusView failCancelled(UUID documentId, ProcessingCancelledException e) {
    boolean interrupted = Thread.interrupted();
    try {
      return fail(
          documentId,
          FailureCode.PROCESSING_CANCELLED,
          "Processing cancelled during " + e.getStage() + "; retry the document to process it");
    } finally {
      if (interrupted || e.getCause() instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void checkCancelled(String stage) {
    if (Thread.currentThread().isInterrupted()) {
      throw new ProcessingCancelledException(stage);
    }
  }

  static FailureCode failureCodeFor(RuntimeException e) {
    if (e instanceof StorageException se) {
      return switch (se.getReason()) {
        case NOT_FOUND -> FailureCode.STORAGE_NOT_FOUND;
        case BACKEND_UNAVAILABLE -> FailureCode.STORAGE_UNAVAILABLE;
      };
    }
    if (e instanceof ExtractionException ee) {
      return switch (ee.getReason()) {
        case UNSUPPORTED_FORMAT -> FailureCode.UNSUPPORTED_FORMAT;
        case CORRUPT_INPUT -> FailureCode.CORRUPT_INPUT;
        case EMPTY_RESULT -> FailureCode.EMPTY_EXTRACTION;
      };
    }
    if (e instanceof SummarizationException se) {
      return switch (se.getReason()) {
        case REMOTE_UNAVAILABLE -> FailureCode.SUMMARIZER_UNAVAILABLE;
        case RATE_LIMITED -> FailureCode.SUMMARIZER_RATE_LIMITED;
        case INVALID_RESPONSE -> FailureCode.SUMMARIZER_INVALID_RESPONSE;
        case AUTH_ERROR -> FailureCode.SUMMARIZER_AUTH_ERROR;
      };
    }
    return FailureCode.INTERNAL_ERROR;
  }
}
