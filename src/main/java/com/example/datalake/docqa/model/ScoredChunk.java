package com.example.datalake.docqa.model;

import java.util.UUID;

/**
 * A single hit of the semantic or keyword lookup. {@code score} is already normalized to [0, 1].
 */
public record ScoredChunk(
    UUID chunkId,
    UUID documentId,
    int chunkIndex,
    String content,
    String filename,
    double score
) {
}
