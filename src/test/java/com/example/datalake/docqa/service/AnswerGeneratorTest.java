package com.example.datalake.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.datalake.docqa.exception.GenerationUnavailableException;
import com.example.datalake.docqa.model.RankedPassage;
import com.example.datalake.docqa.model.SearchType;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AnswerGeneratorTest {

  private final ChatModel chatModel = mock(ChatModel.class);
  private final AnswerGenerator generator = new AnswerGenerator(chatModel);

  @Test
  void emptyContextSkipsTheModel() {
    assertThat(generator.answer("Any question?", List.of())).isEqualTo(AnswerGenerator.NO_ANSWER);
    verifyNoInteractions(chatModel);
  }

  @Test
  void promptCarriesPassagesInRankOrder() {
    when(chatModel.chat(anyString())).thenReturn("  Nine to five.  ");

    String answer = generator.answer("When do you open?", List.of(
        passage("We open at nine."),
        passage("We close at five.")));

    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(chatModel).chat(prompt.capture());
    assertThat(answer).isEqualTo("Nine to five.");
    assertThat(prompt.getValue())
        .contains("We open at nine.\n\n---\n\nWe close at five.")
        .contains("Question: When do you open?")
        .contains(AnswerGenerator.NO_ANSWER);
  }

  @Test
  void blankModelReplyBecomesNoAnswer() {
    when(chatModel.chat(anyString())).thenReturn(" ");

    assertThat(generator.answer("q", List.of(passage("text")))).isEqualTo(AnswerGenerator.NO_ANSWER);
  }

  @Test
  void modelFailureIsWrapped() {
    when(chatModel.chat(anyString())).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> generator.answer("q", List.of(passage("text"))))
        .isInstanceOf(GenerationUnavailableException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void refusalIsDetectedInsideLongerReplies() {
    assertThat(AnswerGenerator.isNoAnswer("Sorry. I don't have enough information to answer that question."))
        .isTrue();
    assertThat(AnswerGenerator.isNoAnswer("We open at nine.")).isFalse();
  }

  private static RankedPassage passage(String content) {
    return new RankedPassage(UUID.randomUUID(), UUID.randomUUID(), 0, content, "hours.txt",
        0.9, 0.5, 0.74, SearchType.HYBRID);
  }
}
