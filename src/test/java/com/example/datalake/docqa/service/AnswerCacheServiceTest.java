package com.example.datalake.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.dao.QueryCacheDao;
import com.example.datalake.docqa.model.CachedAnswer;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.model.SourceReference;
import com.example.datalake.docqa.support.InMemoryQueryCacheDao;
import com.example.datalake.docqa.util.VectorMath;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class AnswerCacheServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
  private static final float[] REFUND = {0.9f, 0.1f, 0.2f};

  private InMemoryQueryCacheDao dao;
  private RagProperties properties;
  private AnswerCacheService cache;

  @BeforeEach
  void setUp() {
    dao = new InMemoryQueryCacheDao();
    properties = new RagProperties();
    cache = new AnswerCacheService(dao, properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void missThenSaveThenHitIncrementsHitCount() {
    assertThat(cache.lookup(REFUND, RoleTag.EXTERNAL)).isEmpty();

    Optional<CachedAnswer> saved = cache.save("What is the refund policy?", REFUND,
        "Refunds are issued within 14 days.", List.of(source()), RoleTag.EXTERNAL);
    assertThat(saved).get().extracting(CachedAnswer::hitCount).isEqualTo(1);

    Optional<CachedAnswer> hit = cache.lookup(REFUND, RoleTag.EXTERNAL);

    assertThat(hit).isPresent();
    assertThat(hit.get().hitCount()).isEqualTo(2);
    assertThat(hit.get().answer()).isEqualTo("Refunds are issued within 14 days.");
    assertThat(hit.get().lastHitAt()).isEqualTo(NOW);
    assertThat(hit.get().sources()).hasSize(1);
  }

  @Test
  void savingSameQuestionTwiceKeepsOneRow() {
    cache.save("What is the refund policy?", REFUND, "first", List.of(), RoleTag.STAFF);
    Optional<CachedAnswer> second = cache.save("What is the refund policy?", REFUND, "second", List.of(), RoleTag.STAFF);

    assertThat(dao.size()).isEqualTo(1);
    assertThat(second).get().satisfies(entry -> {
      assertThat(entry.hitCount()).isEqualTo(2);
      assertThat(entry.answer()).isEqualTo("second");
    });
  }

  @Test
  void paraphraseHitsButIsStoredSeparately() {
    cache.save("What is the refund policy?", REFUND, "answer", List.of(), RoleTag.STAFF);
    float[] paraphrase = {0.88f, 0.12f, 0.21f};

    assertThat(cache.lookup(paraphrase, RoleTag.STAFF)).isPresent();

    cache.save("How do refunds work?", paraphrase, "answer", List.of(), RoleTag.STAFF);
    assertThat(dao.size()).isEqualTo(2);
  }

  @Test
  void thresholdIsInclusive() {
    float[] stored = {1f, 0f};
    float[] query = {0.85f, 0.52678f};
    cache.save("q", stored, "a", List.of(), RoleTag.OWNER);
    double similarity = VectorMath.cosineSimilarity(query, stored);

    assertThat(cache.lookup(query, RoleTag.OWNER, Math.nextUp(similarity))).isEmpty();
    assertThat(cache.lookup(query, RoleTag.OWNER, similarity)).isPresent();
  }

  @Test
  void entriesArePartitionedByRole() {
    cache.save("What is the refund policy?", REFUND, "internal answer", List.of(), RoleTag.STAFF);

    assertThat(cache.lookup(REFUND, RoleTag.EXTERNAL)).isEmpty();
    assertThat(cache.lookup(REFUND, RoleTag.STAFF)).isPresent();
  }

  @Test
  void mostSimilarEntryWins() {
    cache.save("near", new float[] {0.9f, 0.1f, 0.2f}, "near answer", List.of(), RoleTag.OWNER);
    cache.save("nearer", new float[] {0.9f, 0.1f, 0.21f}, "nearer answer", List.of(), RoleTag.OWNER);

    Optional<CachedAnswer> hit = cache.lookup(new float[] {0.9f, 0.1f, 0.21f}, RoleTag.OWNER, 0.5);

    assertThat(hit).get().extracting(CachedAnswer::answer).isEqualTo("nearer answer");
  }

  @Test
  void storageFailuresBecomeMissAndNoOp() {
    QueryCacheDao broken = mock(QueryCacheDao.class);
    when(broken.findByRole(any())).thenThrow(new DataAccessResourceFailureException("down"));
    when(broken.upsert(any(), any(), any(), any(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("down"));
    AnswerCacheService degraded = new AnswerCacheService(broken, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(degraded.lookup(REFUND, RoleTag.EXTERNAL)).isEmpty();
    assertThat(degraded.save("q", REFUND, "a", List.of(), RoleTag.EXTERNAL)).isEmpty();
  }

  @Test
  void pruneRemovesOldRarelyHitEntriesOnly() {
    cache.save("rare", new float[] {1f, 0f, 0f}, "a", List.of(), RoleTag.OWNER);
    cache.save("popular", new float[] {0f, 1f, 0f}, "a", List.of(), RoleTag.OWNER);
    cache.save("popular", new float[] {0f, 1f, 0f}, "a", List.of(), RoleTag.OWNER);
    cache.save("popular", new float[] {0f, 1f, 0f}, "a", List.of(), RoleTag.OWNER);

    Instant later = NOW.plus(Duration.ofDays(91));
    AnswerCacheService laterCache = new AnswerCacheService(dao, properties, Clock.fixed(later, ZoneOffset.UTC));
    laterCache.save("fresh", new float[] {0f, 0f, 1f}, "a", List.of(), RoleTag.OWNER);

    assertThat(laterCache.prune()).isEqualTo(1);
    assertThat(dao.findByRole(RoleTag.OWNER)).extracting(CachedAnswer::question)
        .containsExactlyInAnyOrder("popular", "fresh");
  }

  @Test
  void nothingIsPrunedInsideRetention() {
    cache.save("rare", new float[] {1f, 0f, 0f}, "a", List.of(), RoleTag.OWNER);

    assertThat(cache.prune()).isZero();
  }

  private static SourceReference source() {
    return SourceReference.builder()
        .documentId(UUID.randomUUID())
        .filename("policy.txt")
        .chunkContent("Refunds are issued within 14 days.")
        .relevanceScore(0.91)
        .build();
  }
}
