package com.flamingo.ai.docpipeline.domain.enums;

/**
 * Machine-readable cause of a failed processing attempt.
 *
 * <p>{@link #isTransient()} tells an operator whether a plain retry is likely to help, or whether
 * the input or the configuration has to be fixed first.
 */
public enum FailureCode {
  STORAGE_NOT_FOUND(false),
  STORAGE_UNAVAILABLE(true),
  UNSUPPORTED_FORMAT(false),
  CORRUPT_INPUT(false),
  EMPTY_EXTRACTION(false),
  SUMMARIZER_UNAVAILABLE(true),
  SUMMARIZER_RATE_LIMITED(true),
  SUMMARIZER_INVALID_RESPONSE(true),
  SUMMARIZER_AUTH_ERROR(false),
  PROCESSING_CANCELLED(true),
  PROCESSING_INTERRUPTED(true),
  INTERNAL_ERROR(true);

  private final boolean transientFailure;

  FailureCode(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
