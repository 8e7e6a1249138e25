package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.model.ChunkDraft;
import com.example.datalake.docqa.model.ScoredChunk;
import com.example.datalake.docqa.model.StoredChunk;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Persistence of chunks and their embeddings plus the two retrieval lookups.
 * Every read is scoped to the document ids handed in; visibility is decided by the caller.
 */
public interface ChunkStore {

    /**
     * Store all drafts of a document in one transaction. Either every chunk is written or none.
     *
     * @return ids of the new chunks in draft order
     */
    List<UUID> putChunks(UUID documentId, List<ChunkDraft> drafts);

    /** Idempotent: a second embedding for the same chunk is ignored. */
    void putEmbedding(UUID chunkId, float[] vector);

    /** Chunks of the document that have no embedding yet, ordered by chunk index. */
    List<StoredChunk> chunksMissingEmbedding(UUID documentId);

    int countChunks(UUID documentId);

    /**
     * Every hit with {@code 1 - cosineDistance} strictly above {@code floor}, best first. Not
     * truncated: the caller joins it with the keyword hits before applying its limit.
     */
    List<ScoredChunk> semanticSearch(float[] vector, Collection<UUID> documentIds, double floor);

    /** Every full-text hit with the rank already normalized to [0, 1], best first. Not truncated. */
    List<ScoredChunk> keywordSearch(String question, Collection<UUID> documentIds);

    void deleteByDocument(UUID documentId);
}
