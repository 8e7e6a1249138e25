package com.example.datalake.docqa.response;

import com.example.datalake.docqa.model.SourceReference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Body of the question endpoint. A successful call has an empty {@code errors} list, even when
 * {@code noAnswer} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class AnswerResponse {
  private String question;
  private String role;
  private String answer;
  private List<SourceReference> sources;
  private boolean fromCache;
  private int cacheHitCount;
  private boolean noAnswer;

  private List<String> errors;
}
