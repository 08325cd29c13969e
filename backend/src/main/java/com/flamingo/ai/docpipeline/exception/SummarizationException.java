package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when the remote model fails to produce a summary. */
public class SummarizationException extends RuntimeException {

  /** Why the summarization call failed. */
  public enum Reason {
    /** Network failure, timeout, server error or open circuit. */
    REMOTE_UNAVAILABLE,
    /** The remote service asked the caller to back off. */
    RATE_LIMITED,
    /** The model output was empty or malformed, or the request was rejected. */
    INVALID_RESPONSE,
    /** Credentials were rejected; needs operator action. */
    AUTH_ERROR
  }

  private final Reason reason;

  public SummarizationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SummarizationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
