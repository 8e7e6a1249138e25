package com.example.datalake.docqa.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/** Question payload; blank and over-long questions are rejected by the validation chain. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class AskQuestionRequest {
  private String question;
  /** Role code ({@code business_owner}, {@code employee}, {@code customer}); defaults to customer. */
  private String role;
}
