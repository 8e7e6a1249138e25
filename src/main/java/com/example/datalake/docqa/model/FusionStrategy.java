package com.example.datalake.docqa.model;

/** How semantic and keyword scores are blended, see {@code ScoreFusion}. */
public enum FusionStrategy {
  /** semanticScore * semanticWeight + keywordScore * keywordWeight */
  WEIGHTED,
  /** Reciprocal rank fusion: 1/(k + semanticRank) + 1/(k + keywordRank) */
  RRF
}
