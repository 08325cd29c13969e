package com.flamingo.ai.docpipeline.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Defines the processing status of an uploaded document. */
public enum DocumentStatus {
  /** Document has been stored but not yet picked up for processing. */
  PENDING,

  /** Document is currently being processed (extraction, summarization). */
  PROCESSING,

  /** Document has been extracted and summarized. */
  PROCESSED,

  /** Document processing failed; can be re-entered through an explicit retry. */
  FAILED;

  /** Returns the statuses this status may move to. */
  public Set<DocumentStatus> allowedTargets() {
    return switch (this) {
      case PENDING -> EnumSet.of(PROCESSING);
      case PROCESSING -> EnumSet.of(PROCESSING, PROCESSED, FAILED);
      case PROCESSED, FAILED -> EnumSet.of(PROCESSING);
    };
  }

  /**
   * Returns {@code true} if moving from this status to {@code target} is part of the lifecycle.
   *
   * <p>{@code PROCESSING -> PROCESSING} covers persisting intermediate results (extracted text)
   * while the document is still in flight. {@code PROCESSED/FAILED -> PROCESSING} is only ever
   * taken by an explicit retry.
   */
  public boolean canTransitionTo(DocumentStatus target) {
    return target != null && allowedTargets().contains(target);
  }

  /** Returns {@code true} for statuses no automatic transition leaves. */
  public boolean isTerminal() {
    return this == PROCESSED || this == FAILED;
  }
}
