package com.example.datalake.docqa.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.docqa.exception.InvalidStatusTransitionException;
import org.junit.jupiter.api.Test;

class DocumentStatusTest {

  @Test
  void happyPathMovesForward() {
    DocumentStatus status = DocumentStatus.PROCESSING
        .next(DocumentEvent.CHUNKS_STORED)
        .next(DocumentEvent.EMBEDDINGS_STORED);

    assertThat(status).isEqualTo(DocumentStatus.COMPLETED);
    assertThat(status.isTerminal()).isTrue();
  }

  @Test
  void failureIsReachableFromEveryState() {
    for (DocumentStatus status : DocumentStatus.values()) {
      assertThat(status.next(DocumentEvent.FAILURE)).isEqualTo(DocumentStatus.FAILED);
    }
  }

  @Test
  void onlyFailedDocumentsCanBeRetried() {
    assertThat(DocumentStatus.FAILED.next(DocumentEvent.RETRY)).isEqualTo(DocumentStatus.PROCESSING);
    assertThat(DocumentStatus.COMPLETED.canApply(DocumentEvent.RETRY)).isFalse();
    assertThat(DocumentStatus.PROCESSING.canApply(DocumentEvent.RETRY)).isFalse();
  }

  @Test
  void statusNeverMovesBackwards() {
    assertThatThrownBy(() -> DocumentStatus.COMPLETED.next(DocumentEvent.CHUNKS_STORED))
        .isInstanceOf(InvalidStatusTransitionException.class);
    assertThatThrownBy(() -> DocumentStatus.PROCESSING.next(DocumentEvent.EMBEDDINGS_STORED))
        .isInstanceOf(InvalidStatusTransitionException.class);
  }

  @Test
  void codesRoundTripThroughFromCode() {
    assertThat(DocumentStatus.fromCode("chunks_created")).isEqualTo(DocumentStatus.CHUNKS_CREATED);
    assertThat(DocumentStatus.fromCode(" Completed ")).isEqualTo(DocumentStatus.COMPLETED);
    assertThatThrownBy(() -> DocumentStatus.fromCode("done")).isInstanceOf(IllegalArgumentException.class);
  }
}
