package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.model.CachedAnswer;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.model.SourceReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcQueryCacheDao implements QueryCacheDao {

    private static final TypeReference<List<SourceReference>> SOURCES = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public List<CachedAnswer> findByRole(RoleTag role) {
        final String sql = """
                SELECT id, question, role, question_embedding::text AS question_embedding, answer,
                       sources::text AS sources, hit_count, last_hit_at, created_at, updated_at
                FROM query_cache
                WHERE role = :role
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource("role", role.code()), rowMapper());
    }

    @Override
    public int recordHit(UUID id, Instant hitAt) {
        final String sql = """
                UPDATE query_cache
                SET hit_count = hit_count + 1, last_hit_at = :hitAt
                WHERE id = :id
                RETURNING hit_count
                """;
        List<Integer> counts = jdbcTemplate.query(sql, new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("hitAt", Timestamp.from(hitAt)),
                (rs, rowNum) -> rs.getInt("hit_count"));
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    @Override
    public CachedAnswer upsert(String question, RoleTag role, float[] questionEmbedding, String answer,
                               List<SourceReference> sources, Instant now) {
        final String sql = """
                INSERT INTO query_cache (id, question, role, question_embedding, answer, sources,
                                         hit_count, last_hit_at, created_at, updated_at)
                VALUES (:id, :question, :role, :embedding, :answer, CAST(:sources AS jsonb),
                        1, :now, :now, :now)
                ON CONFLICT (question, role) DO UPDATE
                SET hit_count = query_cache.hit_count + 1,
                    answer = EXCLUDED.answer,
                    question_embedding = EXCLUDED.question_embedding,
                    sources = EXCLUDED.sources,
                    last_hit_at = EXCLUDED.last_hit_at,
                    updated_at = EXCLUDED.updated_at
                RETURNING id, question, role, question_embedding::text AS question_embedding, answer,
                          sources::text AS sources, hit_count, last_hit_at, created_at, updated_at
                """;

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("question", question)
                .addValue("role", role.code())
                .addValue("embedding", new PGvector(questionEmbedding))
                .addValue("answer", answer)
                .addValue("sources", toJson(sources))
                .addValue("now", Timestamp.from(now));

        return jdbcTemplate.queryForObject(sql, params, rowMapper());
    }

    @Override
    public int deleteStale(Instant cutoff, int minHits) {
        final String sql = """
                DELETE FROM query_cache
                WHERE created_at < :cutoff
                  AND hit_count < :minHits
                """;
        return jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("cutoff", Timestamp.from(cutoff))
                .addValue("minHits", minHits));
    }

    private RowMapper<CachedAnswer> rowMapper() {
        return (rs, rowNum) -> new CachedAnswer(
                rs.getObject("id", UUID.class),
                rs.getString("question"),
                RoleTag.fromCode(rs.getString("role")),
                toVector(rs.getString("question_embedding")),
                rs.getString("answer"),
                fromJson(rs.getString("sources")),
                rs.getInt("hit_count"),
                toInstant(rs.getTimestamp("last_hit_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                1.0);
    }

    private static float[] toVector(String text) throws SQLException {
        return text == null ? new float[0] : new PGvector(text).toArray();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private String toJson(List<SourceReference> sources) {
        try {
            return objectMapper.writeValueAsString(sources == null ? List.of() : sources);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache sources", e);
        }
    }

    private List<SourceReference> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, SOURCES);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache sources, returning none – {}", e.getMessage());
            return List.of();
        }
    }
}
