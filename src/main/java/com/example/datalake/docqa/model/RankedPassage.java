package com.example.datalake.docqa.model;

import java.util.UUID;

/** Output row of the hybrid ranker. Missing sides carry a 0 score. */
public record RankedPassage(
    UUID chunkId,
    UUID documentId,
    int chunkIndex,
    String content,
    String filename,
    double semanticScore,
    double keywordScore,
    double combinedScore,
    SearchType searchType
) {
}
