package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.model.ChunkDraft;
import com.example.datalake.docqa.model.ScoredChunk;
import com.example.datalake.docqa.model.StoredChunk;
import com.example.datalake.docqa.util.VectorMath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * {@link ChunkStore} over PostgreSQL. Similarity uses the pgvector cosine distance operator
 * {@code <=>}; keyword lookup uses {@code ts_rank} over an english {@code tsvector}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PgChunkStore implements ChunkStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RagProperties properties;

    @Override
    @Transactional
    public List<UUID> putChunks(UUID documentId, List<ChunkDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }

        final String sql = """
                INSERT INTO chunks (id, document_id, chunk_index, content, metadata)
                VALUES (:id, :documentId, :chunkIndex, :content, CAST(:metadata AS jsonb))
                """;

        List<UUID> ids = new ArrayList<>(drafts.size());
        SqlParameterSource[] batch = new SqlParameterSource[drafts.size()];
        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft draft = drafts.get(i);
            UUID id = UUID.randomUUID();
            ids.add(id);
            batch[i] = new MapSqlParameterSource()
                    .addValue("id", id)
                    .addValue("documentId", documentId)
                    .addValue("chunkIndex", draft.chunkIndex())
                    .addValue("content", draft.content())
                    .addValue("metadata", toJson(draft));
        }
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Stored {} chunks for document {}", ids.size(), documentId);
        return ids;
    }

    @Override
    public void putEmbedding(UUID chunkId, float[] vector) {
        final String sql = """
                INSERT INTO embeddings (id, chunk_id, embedding)
                VALUES (:id, :chunkId, :embedding)
                ON CONFLICT (chunk_id) DO NOTHING
                """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("chunkId", chunkId)
                .addValue("embedding", new PGvector(vector)));
    }

    @Override
    public List<StoredChunk> chunksMissingEmbedding(UUID documentId) {
        final String sql = """
                SELECT c.id, c.document_id, c.chunk_index, c.content
                FROM chunks c
                LEFT JOIN embeddings e ON e.chunk_id = c.id
                WHERE c.document_id = :documentId
                  AND e.id IS NULL
                ORDER BY c.chunk_index
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource("documentId", documentId),
                (rs, rowNum) -> new StoredChunk(
                        rs.getObject("id", UUID.class),
                        rs.getObject("document_id", UUID.class),
                        rs.getInt("chunk_index"),
                        rs.getString("content")));
    }

    @Override
    public int countChunks(UUID documentId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM chunks WHERE document_id = :documentId",
                new MapSqlParameterSource("documentId", documentId),
                Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<ScoredChunk> semanticSearch(float[] vector, Collection<UUID> documentIds, double floor) {
        if (documentIds == null || documentIds.isEmpty() || vector == null || vector.length == 0) {
            return List.of();
        }

        final String sql = """
                SELECT c.id, c.document_id, c.chunk_index, c.content, d.filename,
                       1 - (e.embedding <=> :embedding) AS similarity
                FROM embeddings e
                JOIN chunks c ON c.id = e.chunk_id
                JOIN documents d ON d.id = c.document_id
                WHERE c.document_id IN (:documentIds)
                  AND 1 - (e.embedding <=> :embedding) > :floor
                ORDER BY e.embedding <=> :embedding
                """;

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("embedding", new PGvector(vector))
                .addValue("documentIds", documentIds)
                .addValue("floor", floor);

        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new ScoredChunk(
                rs.getObject("id", UUID.class),
                rs.getObject("document_id", UUID.class),
                rs.getInt("chunk_index"),
                rs.getString("content"),
                rs.getString("filename"),
                rs.getDouble("similarity")));
    }

    @Override
    public List<ScoredChunk> keywordSearch(String question, Collection<UUID> documentIds) {
        if (documentIds == null || documentIds.isEmpty() || question == null || question.isBlank()) {
            return List.of();
        }

        final String sql = """
                SELECT c.id, c.document_id, c.chunk_index, c.content, d.filename,
                       ts_rank(to_tsvector('english', c.content), plainto_tsquery('english', :question)) AS rank
                FROM chunks c
                JOIN documents d ON d.id = c.document_id
                WHERE c.document_id IN (:documentIds)
                  AND to_tsvector('english', c.content) @@ plainto_tsquery('english', :question)
                ORDER BY rank DESC
                """;

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("question", question)
                .addValue("documentIds", documentIds);

        double multiplier = properties.getSearch().getKeywordRankMultiplier();
        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new ScoredChunk(
                rs.getObject("id", UUID.class),
                rs.getObject("document_id", UUID.class),
                rs.getInt("chunk_index"),
                rs.getString("content"),
                rs.getString("filename"),
                VectorMath.normalizeKeywordRank(rs.getDouble("rank"), multiplier)));
    }

    @Override
    public void deleteByDocument(UUID documentId) {
        // embeddings go with their chunks through ON DELETE CASCADE
        int deleted = jdbcTemplate.update("DELETE FROM chunks WHERE document_id = :documentId",
                new MapSqlParameterSource("documentId", documentId));
        log.debug("Deleted {} chunks of document {}", deleted, documentId);
    }

    private String toJson(ChunkDraft draft) {
        try {
            return objectMapper.writeValueAsString(draft.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize metadata of chunk " + draft.chunkIndex(), e);
        }
    }
}
