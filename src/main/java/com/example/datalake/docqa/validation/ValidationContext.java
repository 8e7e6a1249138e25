package com.example.datalake.docqa.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the question through the validators. Validators may replace the processed question and
 * attach notices for the caller.
 */
public class ValidationContext {

  private final String rawQuestion;
  private String processedQuestion;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawQuestion) {
    this.rawQuestion = rawQuestion;
    this.processedQuestion = rawQuestion;
  }

  public String getRawQuestion() {
    return rawQuestion;
  }

  public String getProcessedQuestion() {
    return processedQuestion;
  }

  public void setProcessedQuestion(String processedQuestion) {
    this.processedQuestion = processedQuestion;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
