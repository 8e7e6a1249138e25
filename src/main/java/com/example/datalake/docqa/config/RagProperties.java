package com.example.datalake.docqa.config;

import com.example.datalake.docqa.model.FusionStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds properties under {@code docqa.rag}:
 *
 * docqa.rag.chunking.max-size=1000
 * docqa.rag.search.semantic-weight=0.6
 * docqa.rag.cache.similarity-threshold=0.85
 * docqa.rag.ingestion.embedding-concurrency=4
 */
@Data
@Validated
@ConfigurationProperties(prefix = "docqa.rag")
public class RagProperties {

    private Chunking chunking = new Chunking();
    private Search search = new Search();
    private Cache cache = new Cache();
    private Ingestion ingestion = new Ingestion();
    private Answer answer = new Answer();

    @Data
    public static class Chunking {
        /** Soft upper bound of a chunk in characters; a single long sentence may exceed it. */
        private int maxSize = 1000;
        /** Overlap budget; the carried-over word count is overlap / 5. */
        private int overlap = 200;
    }

    @Data
    public static class Search {
        private double semanticWeight = 0.6;
        private double keywordWeight = 0.4;
        private int limit = 20;
        /** Semantic matches must score strictly above this. */
        private double semanticFloor = 0.2;
        /** Raw full-text rank is multiplied by this and capped at 1.0. */
        private double keywordRankMultiplier = 2.0;
        private Duration subSearchTimeout = Duration.ofSeconds(5);
        private FusionStrategy fusion = FusionStrategy.WEIGHTED;
        private int rrfK = 60;
    }

    @Data
    public static class Cache {
        private double similarityThreshold = 0.85;
        private Duration retention = Duration.ofDays(90);
        /** Entries with fewer hits than this are eligible for pruning once past retention. */
        private int minHitsToKeep = 3;
        private String pruneCron = "0 30 3 * * *";
    }

    @Data
    public static class Ingestion {
        private int embeddingConcurrency = 4;
        private Duration deadline = Duration.ofMinutes(5);
    }

    @Data
    public static class Answer {
        private Duration deadline = Duration.ofSeconds(60);
        private int maxQuestionChars = 2000;
        private int sourcePreviewChars = 200;
    }
}
