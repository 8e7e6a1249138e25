package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.model.CachedAnswer;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.model.SourceReference;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface QueryCacheDao {

    /** All entries of one role partition; similarity is computed by the caller. */
    List<CachedAnswer> findByRole(RoleTag role);

    /**
     * Increment the hit count and set {@code last_hit_at}.
     *
     * @return the new hit count, or 0 when the entry no longer exists
     */
    int recordHit(UUID id, Instant hitAt);

    /**
     * Insert with {@code hit_count = 1}, or on an existing {@code (question, role)} increment the
     * hit count and overwrite answer, embedding and sources.
     */
    CachedAnswer upsert(String question, RoleTag role, float[] questionEmbedding, String answer,
                        List<SourceReference> sources, Instant now);

    /** Delete entries created before {@code cutoff} with fewer than {@code minHits} hits. */
    int deleteStale(Instant cutoff, int minHits);
}
