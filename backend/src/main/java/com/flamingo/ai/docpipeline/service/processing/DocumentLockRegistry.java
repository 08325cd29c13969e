package com.flamingo.ai.docpipeline.service.processing;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * In-process, non-blocking mutual exclusion per document id.
 *
 * <p>Locks are not reentrant and must be released by the thread that acquired them.
 */
@Component
public class DocumentLockRegistry {

  private final ConcurrentMap<UUID, Thread> owners = new ConcurrentHashMap<>();

  /** Acquires the lock for a document if nobody holds it; never blocks. */
  public boolean tryLock(UUID documentId) {
    return owners.putIfAbsent(documentId, Thread.currentThread()) == null;
  }

  /** Releases a lock held by the current thread. */
  public void unlock(UUID documentId) {
    if (!owners.remove(documentId, Thread.currentThread())) {
      throw new IllegalMonitorStateException(
          "Lock for document " + documentId + " is not held by " + Thread.currentThread());
    }
  }

  public boolean isLocked(UUID documentId) {
    return owners.containsKey(documentId);
  }

  public int lockedCount() {
    return owners.size();
  }
}
