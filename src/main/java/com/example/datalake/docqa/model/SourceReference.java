package com.example.datalake.docqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Citation returned with an answer. Serialized as-is into {@code query_cache.sources}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceReference {

  @JsonProperty("document_id")
  private UUID documentId;

  private String filename;

  @JsonProperty("chunk_content")
  private String chunkContent;

  @JsonProperty("relevance_score")
  private double relevanceScore;
}
