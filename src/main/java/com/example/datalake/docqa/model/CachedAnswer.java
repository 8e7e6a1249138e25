package com.example.datalake.docqa.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Row of the answer cache. {@code similarity} is only meaningful on a lookup hit and is 1.0 for
 * entries returned by a save.
 */
public record CachedAnswer(
    UUID id,
    String question,
    RoleTag role,
    float[] questionEmbedding,
    String answer,
    List<SourceReference> sources,
    int hitCount,
    Instant lastHitAt,
    Instant createdAt,
    Instant updatedAt,
    double similarity
) {

  public CachedAnswer {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public CachedAnswer withHit(int newHitCount, Instant hitAt, double matchedSimilarity) {
    return new CachedAnswer(id, question, role, questionEmbedding, answer, sources,
        newHitCount, hitAt, createdAt, updatedAt, matchedSimilarity);
  }
}
