package com.example.datalake.docqa.service;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.dao.ChunkStore;
import com.example.datalake.docqa.model.FusionStrategy;
import com.example.datalake.docqa.model.RankedPassage;
import com.example.datalake.docqa.model.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs the semantic and keyword lookups side by side and fuses them. Both sides are complete hit
 * sets; {@code limit} applies only to the fused list. A side that fails or runs
 * past its timeout contributes nothing instead of failing the query.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridSearchService {

    private final ChunkStore chunkStore;
    private final RagProperties properties;

    public Mono<List<RankedPassage>> search(String question, float[] questionVector, Collection<UUID> documentIds) {
        RagProperties.Search cfg = properties.getSearch();
        return search(question, questionVector, documentIds, cfg.getSemanticWeight(), cfg.getKeywordWeight(), cfg.getLimit());
    }

    public Mono<List<RankedPassage>> search(String question,
                                            float[] questionVector,
                                            Collection<UUID> documentIds,
                                            double semanticWeight,
                                            double keywordWeight,
                                            int limit) {
        if (documentIds == null || documentIds.isEmpty()) {
            log.debug("No visible documents, skipping search");
            return Mono.just(List.of());
        }
        RagProperties.Search cfg = properties.getSearch();

        Mono<List<ScoredChunk>> semantic = side("semantic",
                () -> chunkStore.semanticSearch(questionVector, documentIds, cfg.getSemanticFloor()),
                cfg.getSubSearchTimeout());
        Mono<List<ScoredChunk>> keyword = side("keyword",
                () -> chunkStore.keywordSearch(question, documentIds),
                cfg.getSubSearchTimeout());

        return Mono.zip(semantic, keyword)
                .map(tuple -> {
                    List<RankedPassage> fused = cfg.getFusion() == FusionStrategy.RRF
                            ? ScoreFusion.reciprocalRank(tuple.getT1(), tuple.getT2(), cfg.getRrfK(), limit)
                            : ScoreFusion.weighted(tuple.getT1(), tuple.getT2(), semanticWeight, keywordWeight, limit);
                    log.debug("Hybrid search: semantic={}, keyword={}, fused={}",
                            tuple.getT1().size(), tuple.getT2().size(), fused.size());
                    return fused;
                });
    }

    private Mono<List<ScoredChunk>> side(String name, Supplier<List<ScoredChunk>> lookup, Duration timeout) {
        return Mono.fromSupplier(lookup)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("{} search degraded to empty – {}", name, e.toString());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }
}
