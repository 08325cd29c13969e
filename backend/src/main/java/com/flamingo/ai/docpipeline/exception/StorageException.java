package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when a storage backend cannot serve a request. */
public class StorageException extends RuntimeException {

  /** Why the storage call failed. */
  public enum Reason {
    /** The locator does not name any stored object. */
    NOT_FOUND,
    /** The underlying medium could not be reached. */
    BACKEND_UNAVAILABLE
  }

  private final Reason reason;
  private final String locator;

  public StorageException(Reason reason, String locator, String message) {
    super(message);
    this.reason = reason;
    this.locator = locator;
  }

  public StorageException(Reason reason, String locator, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.locator = locator;
  }

  public static StorageException notFound(String locator) {
    return new StorageException(Reason.NOT_FOUND, locator, "No stored object for " + locator);
  }

  public static StorageException unavailable(String locator, Throwable cause) {
    return new StorageException(
        Reason.BACKEND_UNAVAILABLE,
        locator,
        "Storage backend unavailable for " + locator + ": " + cause.getMessage(),
        cause);
  }

  public Reason getReason() {
    return reason;
  }

  public String getLocator() {
    return locator;
  }
}
