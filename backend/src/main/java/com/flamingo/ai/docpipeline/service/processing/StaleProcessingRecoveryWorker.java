package com.flamingo.ai.docpipeline.service.processing;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.domain.enums.FailureCode;
import com.flamingo.ai.docpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.docpipeline.exception.RepositoryUnavailableException;
import com.flamingo.ai.docpipeline.service.document.DocumentStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails documents abandoned in PROCESSING, for example by a crash mid-attempt, so they can be
 * retried. Documents with an attempt still running in this process are left alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleProcessingRecoveryWorker {

  private final DocumentStateStore stateStore;
  private final DocumentLockRegistry lockRegistry;
  private final ProcessingSettings settings;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      initialDelayString = "${pipeline.processing.stale-check-interval-ms:60000}",
      fixedDelayString = "${pipeline.processing.stale-check-interval-ms:60000}")
  public void recoverStaleDocuments() {
    log.debug("Checking for documents stuck in PROCESSING...");
    try {
      int recovered = recover(LocalDateTime.now().minus(settings.staleThreshold()));
      if (recovered > 0) {
        log.info("Marked {} abandoned documents as FAILED", recovered);
      }
    } catch (RepositoryUnavailableException e) {
      log.warn("Skipping stale document check, document store unavailable: {}", e.getMessage());
    }
  }

  /** Fails every document in PROCESSING not updated since {@code cutoff}; returns the count. */
  int recover(LocalDateTime cutoff) {
    List<Document> stuck = stateStore.findStuckProcessing(cutoff);
    int recovered = 0;
    for (Document document : stuck) {
      if (recoverOne(document.getId())) {
        recovered++;
      }
    }
    return recovered;
  }

  private boolean recoverOne(UUID documentId) {
    if (!lockRegistry.tryLock(documentId)) {
      log.debug("Document {} is still being processed, not recovering", documentId);
      return false;
    }
    try {
      Document current = stateStore.load(documentId);
      if (current.getStatus() != DocumentStatus.PROCESSING) {
        return false;
      }
      stateStore.apply(
          documentId,
          d ->
              d.markFailed(
                  FailureCode.PROCESSING_INTERRUPTED,
                  "Processing interrupted: no progress for more than "
                      + settings.staleThreshold().toMinutes()
                      + " minutes; retry the document to process it"));
      meterRegistry.counter("document.processing.recovered").increment();
      log.warn("Document {} was stuck in PROCESSING, marked FAILED", documentId);
      return true;
    } catch (OptimisticLockingFailureException | DocumentNotFoundException e) {
      log.info("Document {} changed while recovering, leaving it as is", documentId);
      return false;
    } finally {
      lockRegistry.unlock(documentId);
    }
  }
}
