package com.example.datalake.docqa.model;

import java.util.Map;

/** A chunk about to be persisted; {@code chunkIndex} is its 0-based position in the document. */
public record ChunkDraft(int chunkIndex, String content, Map<String, Object> metadata) {

  public ChunkDraft {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
