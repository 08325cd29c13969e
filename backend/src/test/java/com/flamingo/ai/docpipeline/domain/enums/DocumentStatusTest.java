package com.flamingo.ai.docpipeline.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DocumentStatus transition table")
class DocumentStatusTest {

  @ParameterizedTest(name = "{0} -> {1} allowed={2}")
  @CsvSource({
    "PENDING, PROCESSING, true",
    "PENDING, PROCESSED, false",
    "PENDING, FAILED, false",
    "PENDING, PENDING, false",
    "PROCESSING, PROCESSING, true",
    "PROCESSING, PROCESSED, true",
    "PROCESSING, FAILED, true",
    "PROCESSING, PENDING, false",
    "PROCESSED, PROCESSING, true",
    "PROCESSED, FAILED, false",
    "PROCESSED, PENDING, false",
    "FAILED, PROCESSING, true",
    "FAILED, PROCESSED, false",
    "FAILED, PENDING, false"
  })
  void shouldFollowTransitionTable(DocumentStatus from, DocumentStatus to, boolean allowed) {
    assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
  }

  @Test
  void shouldRejectNullTarget() {
    assertThat(DocumentStatus.PENDING.canTransitionTo(null)).isFalse();
  }

  @Test
  void shouldTreatOnlyProcessedAndFailedAsTerminal() {
    assertThat(DocumentStatus.PROCESSED.isTerminal()).isTrue();
    assertThat(DocumentStatus.FAILED.isTerminal()).isTrue();
    assertThat(DocumentStatus.PENDING.isTerminal()).isFalse();
    assertThat(DocumentStatus.PROCESSING.isTerminal()).isFalse();
  }
}
