package com.example.datalake.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.datalake.docqa.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

  private final EmbeddingModel model = mock(EmbeddingModel.class);
  private final EmbeddingService service = new EmbeddingService(model);

  @Test
  void returnsModelVector() {
    when(model.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] {0.5f, 0.25f})));

    assertThat(service.embed("opening hours")).containsExactly(0.5f, 0.25f);
  }

  @Test
  void blankTextIsRejectedWithoutCallingTheModel() {
    assertThatThrownBy(() -> service.embed("  ")).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(model);
  }

  @Test
  void modelFailureIsWrapped() {
    when(model.embed(anyString())).thenThrow(new IllegalStateException("429"));

    assertThatThrownBy(() -> service.embed("opening hours"))
        .isInstanceOf(EmbeddingUnavailableException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }
}
