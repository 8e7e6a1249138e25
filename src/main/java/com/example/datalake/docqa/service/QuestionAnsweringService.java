package com.example.datalake.docqa.service;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.exception.GenerationUnavailableException;
import com.example.datalake.docqa.model.AnswerResult;
import com.example.datalake.docqa.model.CachedAnswer;
import com.example.datalake.docqa.model.RankedPassage;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.model.SourceReference;
import com.example.datalake.docqa.validation.ValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * validate -> embed -> access filter -> cache probe -> hybrid search -> generate -> cache save.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionAnsweringService {

    private final ValidationService validationService;
    private final EmbeddingService embeddingService;
    private final AccessFilterProvider accessFilter;
    private final AnswerCacheService answerCache;
    private final HybridSearchService hybridSearch;
    private final AnswerGenerator answerGenerator;
    private final ChatHistoryService chatHistoryService;
    private final RagProperties properties;

    public Mono<AnswerResult> ask(String rawQuestion, RoleTag role) {
        RoleTag resolvedRole = role == null ? RoleTag.EXTERNAL : role;
        Duration deadline = properties.getAnswer().getDeadline();

        return Mono.fromCallable(() -> validationService.validate(rawQuestion).getProcessedQuestion())
                .flatMap(question -> Mono.fromCallable(() -> embeddingService.embed(question))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(vector -> answer(question, vector, resolvedRole)))
                .timeout(deadline)
                .onErrorMap(TimeoutException.class,
                        e -> new GenerationUnavailableException("No answer within " + deadline, e))
                .doOnNext(result -> recordHistory(result));
    }

    private Mono<AnswerResult> answer(String question, float[] vector, RoleTag role) {
        return Mono.fromCallable(() -> accessFilter.visibleDocumentIds(role))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(documentIds -> {
                    Optional<CachedAnswer> cached = answerCache.lookup(vector, role);
                    if (cached.isPresent()) {
                        return Mono.just(fromCache(question, role, cached.get()));
                    }
                    return generate(question, vector, role, documentIds);
                });
    }

    private Mono<AnswerResult> generate(String question, float[] vector, RoleTag role, Set<UUID> documentIds) {
        return hybridSearch.search(question, vector, documentIds)
                .flatMap(passages -> Mono.fromCallable(() -> {
                            String answer = answerGenerator.answer(question, passages);
                            boolean noAnswer = AnswerGenerator.isNoAnswer(answer);
                            List<SourceReference> sources = noAnswer ? List.of() : toSources(passages);
                            if (!noAnswer) {
                                answerCache.save(question, vector, answer, sources, role);
                            }
                            return AnswerResult.builder()
                                    .question(question)
                                    .role(role)
                                    .answer(answer)
                                    .sources(sources)
                                    .fromCache(false)
                                    .noAnswer(noAnswer)
                                    .passagesUsed(passages.size())
                                    .build();
                        })
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    private AnswerResult fromCache(String question, RoleTag role, CachedAnswer cached) {
        return AnswerResult.builder()
                .question(question)
                .role(role)
                .answer(cached.answer())
                .sources(cached.sources())
                .fromCache(true)
                .cacheHitCount(cached.hitCount())
                .noAnswer(AnswerGenerator.isNoAnswer(cached.answer()))
                .build();
    }

    private List<SourceReference> toSources(List<RankedPassage> passages) {
        int preview = properties.getAnswer().getSourcePreviewChars();
        return passages.stream()
                .map(p -> SourceReference.builder()
                        .documentId(p.documentId())
                        .filename(p.filename())
                        .chunkContent(clip(p.content(), preview))
                        .relevanceScore(p.combinedScore())
                        .build())
                .toList();
    }

    private void recordHistory(AnswerResult result) {
        if (result.getRole() == RoleTag.EXTERNAL) {
            return;
        }
        List<UUID> documentIds = result.getSources().stream()
                .map(SourceReference::getDocumentId)
                .distinct()
                .toList();
        try {
            chatHistoryService.record(result.getQuestion(), result.getAnswer(), result.getRole(), documentIds);
        } catch (RuntimeException e) {
            log.warn("Unable to record chat history – {}", e.getMessage());
        }
    }

    private static String clip(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
}
