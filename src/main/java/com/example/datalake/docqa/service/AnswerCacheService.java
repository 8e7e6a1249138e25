package com.example.datalake.docqa.service;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.dao.QueryCacheDao;
import com.example.datalake.docqa.model.CachedAnswer;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.model.SourceReference;
import com.example.datalake.docqa.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Semantic answer cache partitioned by role.
 *
 * <p>Lookup matches by cosine similarity of the question embedding, while save upserts on the
 * exact question text. A paraphrase therefore hits an existing entry but saving it creates a
 * second row. Cache failures never fail a question: lookup degrades to a miss and save to a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerCacheService {

  private final QueryCacheDao cacheDao;
  private final RagProperties properties;
  private final Clock clock;

  public Optional<CachedAnswer> lookup(float[] questionVector, RoleTag role) {
    return lookup(questionVector, role, properties.getCache().getSimilarityThreshold());
  }

  /** Best entry with similarity {@code >= threshold}; a hit increments its hit count. */
  public Optional<CachedAnswer> lookup(float[] questionVector, RoleTag role, double threshold) {
    if (questionVector == null || questionVector.length == 0 || role == null) {
      return Optional.empty();
    }
    try {
      CachedAnswer best = null;
      double bestSimilarity = Double.NEGATIVE_INFINITY;
      for (CachedAnswer entry : cacheDao.findByRole(role)) {
        double similarity = VectorMath.cosineSimilarity(questionVector, entry.questionEmbedding());
        if (Double.isNaN(similarity) || similarity < threshold) {
          continue;
        }
        if (similarity > bestSimilarity) {
          best = entry;
          bestSimilarity = similarity;
        }
      }
      if (best == null) {
        log.debug("Cache miss for role {}", role.code());
        return Optional.empty();
      }

      Instant now = clock.instant();
      int hits = cacheDao.recordHit(best.id(), now);
      if (hits == 0) {
        log.debug("Cache entry {} vanished before hit could be recorded", best.id());
        return Optional.empty();
      }
      log.debug("Cache hit for role {} (similarity={}, hits={})", role.code(), bestSimilarity, hits);
      return Optional.of(best.withHit(hits, now, bestSimilarity));
    } catch (RuntimeException e) {
      log.warn("Cache lookup failed, treating as miss – {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Optional<CachedAnswer> save(String question,
                                     float[] questionVector,
                                     String answer,
                                     List<SourceReference> sources,
                                     RoleTag role) {
    if (question == null || question.isBlank() || answer == null || role == null) {
      return Optional.empty();
    }
    try {
      CachedAnswer saved = cacheDao.upsert(question, role, questionVector, answer, sources, clock.instant());
      log.debug("Cached answer for role {} (hits={})", role.code(), saved == null ? 0 : saved.hitCount());
      return Optional.ofNullable(saved);
    } catch (RuntimeException e) {
      log.warn("Cache save failed, answer not cached – {}", e.getMessage());
      return Optional.empty();
    }
  }

  /** Remove entries past the retention horizon that were rarely hit. */
  public int prune() {
    RagProperties.Cache cfg = properties.getCache();
    Instant cutoff = clock.instant().minus(cfg.getRetention());
    int removed = cacheDao.deleteStale(cutoff, cfg.getMinHitsToKeep());
    log.info("Pruned {} cache entries created before {} with fewer than {} hits",
        removed, cutoff, cfg.getMinHitsToKeep());
    return removed;
  }
}
