package com.flamingo.ai.docpipeline.storage;

import java.util.UUID;

/**
 * Uniform byte-blob store for uploaded documents.
 *
 * <p>Exactly one implementation is active per process; it is chosen at startup by {@link
 * com.flamingo.ai.docpipeline.config.StorageConfig}. Implementations must be thread-safe and must
 * not cache: every call goes to the backing medium.
 *
 * <p>Failures are reported as {@link com.flamingo.ai.docpipeline.exception.StorageException} with
 * reason {@code NOT_FOUND} or {@code BACKEND_UNAVAILABLE}, so callers can tell a permanent miss
 * from a transient outage.
 */
public interface StorageBackend {

  /**
   * Stores the bytes of a document.
   *
   * <p>The locator is derived from {@code documentId}; storing again for the same document replaces
   * that document's bytes and never touches another document's.
   *
   * @param documentId id of the owning document
   * @param bytes raw document content
   * @param metadata descriptive metadata kept alongside the bytes where the backend supports it
   * @return opaque locator for {@link #get(String)}
   */
  String put(UUID documentId, byte[] bytes, StoredObjectMetadata metadata);

  /**
   * Reads back stored bytes.
   *
   * @param locator value previously returned by {@link #put}
   * @return the stored bytes, byte-identical to what was put
   */
  byte[] get(String locator);

  /** Returns {@code true} if an object is stored under the locator. */
  boolean exists(String locator);

  /** Short backend name for logs and health output. */
  String name();
}
