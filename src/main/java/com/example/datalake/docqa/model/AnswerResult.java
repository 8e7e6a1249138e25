package com.example.datalake.docqa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of answering one question. {@code noAnswer} is a successful result meaning the
 * documents could not ground an answer; it is not an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResult {
  private String question;
  private RoleTag role;
  private String answer;
  @Builder.Default
  private List<SourceReference> sources = List.of();
  private boolean fromCache;
  private int cacheHitCount;
  private boolean noAnswer;
  private int passagesUsed;
}
