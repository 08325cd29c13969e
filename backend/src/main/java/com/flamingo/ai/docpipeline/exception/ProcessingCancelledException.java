package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when the processing thread is interrupted mid-pipeline. */
public class ProcessingCancelledException extends RuntimeException {

  private final String stage;

  public ProcessingCancelledException(String stage) {
    super("Processing cancelled during " + stage);
    this.stage = stage;
  }

  public ProcessingCancelledException(String stage, Throwable cause) {
    super("Processing cancelled during " + stage, cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
