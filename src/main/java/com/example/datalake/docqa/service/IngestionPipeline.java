package com.example.datalake.docqa.service;

import com.example.datalake.docqa.config.RagProperties;
import com.example.datalake.docqa.dao.ChunkStore;
import com.example.datalake.docqa.dao.DocumentRepository;
import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.exception.ConflictException;
import com.example.datalake.docqa.exception.ExtractionFailedException;
import com.example.datalake.docqa.exception.IngestionInProgressException;
import com.example.datalake.docqa.exception.NotFoundException;
import com.example.datalake.docqa.model.ChunkDraft;
import com.example.datalake.docqa.model.DocumentEvent;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.IngestionReport;
import com.example.datalake.docqa.model.StoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Drives a document through {@code processing -> chunks_created -> completed}.
 *
 * <p>Every stage is idempotent, so re-running on the same document resumes from the first
 * incomplete step: chunking is skipped once chunks exist and only chunks without an embedding are
 * embedded. A failure marks the document {@code failed} and keeps whatever was persisted. A run
 * that hits its deadline leaves the status as it was.
 */
@Slf4j
@Service
public class IngestionPipeline {

    private final DocumentRepository documentRepository;
    private final ChunkStore chunkStore;
    private final TextChunker chunker;
    private final EmbeddingService embeddingService;
    private final ExtractionService extractionService;
    private final RagProperties properties;

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public IngestionPipeline(DocumentRepository documentRepository,
                             ChunkStore chunkStore,
                             TextChunker chunker,
                             EmbeddingService embeddingService,
                             ExtractionService extractionService,
                             RagProperties properties) {
        this.documentRepository = documentRepository;
        this.chunkStore = chunkStore;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.extractionService = extractionService;
        this.properties = properties;
    }

    public Mono<IngestionReport> ingestText(UUID documentId, String text) {
        return ingest(documentId, () -> text);
    }

    public Mono<IngestionReport> ingestFile(UUID documentId, byte[] content, String mediaType) {
        return ingest(documentId, () -> extractionService.extract(content, mediaType));
    }

    /** Resume an earlier run without new content; fails the document if it still needs chunking. */
    public Mono<IngestionReport> resume(UUID documentId) {
        return ingest(documentId, () -> {
            throw new ExtractionFailedException("No content available to chunk document " + documentId);
        });
    }

    public Mono<IngestionReport> ingest(UUID documentId, Callable<String> textSource) {
        return ingest(documentId, textSource, properties.getIngestion().getDeadline());
    }

    /**
     * @param textSource called only when the document has no chunks yet
     * @param deadline   on expiry the run errors with a {@link TimeoutException} and the status is kept
     */
    public Mono<IngestionReport> ingest(UUID documentId, Callable<String> textSource, Duration deadline) {
        return Mono.defer(() -> {
            if (!inFlight.add(documentId)) {
                return Mono.error(new IngestionInProgressException(documentId));
            }
            IngestionReport report = new IngestionReport(documentId);
            return Mono.fromCallable(() -> prepare(documentId, report))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(doc -> runStages(doc, textSource, report))
                    .timeout(deadline)
                    .doOnError(TimeoutException.class,
                            e -> log.warn("Ingestion of {} exceeded {}, status left unchanged", documentId, deadline))
                    .onErrorResume(IngestionPipeline::marksFailure, e -> markFailed(documentId, report, e))
                    .doFinally(signal -> inFlight.remove(documentId));
        });
    }

    public boolean isRunning(UUID documentId) {
        return inFlight.contains(documentId);
    }

    private DocumentEntity prepare(UUID documentId, IngestionReport report) {
        DocumentEntity doc = documentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));
        if (doc.getStatus() == DocumentStatus.FAILED) {
            transition(doc, DocumentEvent.RETRY);
            doc.setErrorMessage(null);
            documentRepository.save(doc);
            report.addStep("retry", "previous run failed");
        }
        return doc;
    }

    private Mono<IngestionReport> runStages(DocumentEntity doc, Callable<String> textSource, IngestionReport report) {
        if (doc.getStatus() == DocumentStatus.COMPLETED) {
            report.addStep("skip", "already completed");
            return Mono.just(report.setStatus(DocumentStatus.COMPLETED));
        }

        Mono<DocumentEntity> chunked = doc.getStatus() == DocumentStatus.PROCESSING
                ? Mono.fromCallable(() -> chunkStage(doc, textSource, report)).subscribeOn(Schedulers.boundedElastic())
                : Mono.just(doc);

        return chunked
                .flatMap(d -> embedStage(d, report))
                .map(d -> report.setStatus(d.getStatus()));
    }

    private DocumentEntity chunkStage(DocumentEntity doc, Callable<String> textSource, IngestionReport report)
            throws Exception {
        int existing = chunkStore.countChunks(doc.getId());
        if (existing > 0) {
            report.addStep("chunk", "reusing " + existing + " stored chunks");
        } else {
            String text = textSource.call();
            List<ChunkDraft> drafts = chunker.toDrafts(text);
            if (drafts.isEmpty()) {
                throw new ExtractionFailedException("No text content extracted from document");
            }
            List<UUID> ids = chunkStore.putChunks(doc.getId(), drafts);
            report.setChunksCreated(ids.size());
            report.addStep("chunk", "stored " + ids.size() + " chunks");
        }
        transition(doc, DocumentEvent.CHUNKS_STORED);
        documentRepository.save(doc);
        log.info("Document {} moved to {}", doc.getId(), doc.getStatus().code());
        return doc;
    }

    private Mono<DocumentEntity> embedStage(DocumentEntity doc, IngestionReport report) {
        if (doc.getStatus() != DocumentStatus.CHUNKS_CREATED) {
            return Mono.just(doc);
        }
        int concurrency = Math.max(1, properties.getIngestion().getEmbeddingConcurrency());

        return Mono.fromCallable(() -> chunkStore.chunksMissingEmbedding(doc.getId()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .flatMap(chunk -> embedOne(chunk), concurrency)
                .count()
                .flatMap(written -> Mono.fromCallable(() -> finishEmbeddings(doc, written.intValue(), report))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    private Mono<UUID> embedOne(StoredChunk chunk) {
        return Mono.fromCallable(() -> {
            float[] vector = embeddingService.embed(chunk.content());
            chunkStore.putEmbedding(chunk.id(), vector);
            log.debug("Embedded chunk {} of document {}", chunk.chunkIndex(), chunk.documentId());
            return chunk.id();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private DocumentEntity finishEmbeddings(DocumentEntity doc, int written, IngestionReport report) {
        report.setEmbeddingsCreated(written);
        // read again after all writes; an earlier snapshot can be stale
        List<StoredChunk> stillMissing = chunkStore.chunksMissingEmbedding(doc.getId());
        if (!stillMissing.isEmpty()) {
            throw new IllegalStateException(stillMissing.size() + " chunks still have no embedding");
        }
        report.addStep("embed", "stored " + written + " embeddings");
        transition(doc, DocumentEvent.EMBEDDINGS_STORED);
        documentRepository.save(doc);
        log.info("Document {} moved to {}", doc.getId(), doc.getStatus().code());
        return doc;
    }

    private Mono<IngestionReport> markFailed(UUID documentId, IngestionReport report, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return Mono.fromCallable(() -> {
                    DocumentEntity doc = documentRepository.findById(documentId)
                            .orElseThrow(() -> NotFoundException.document(documentId));
                    transition(doc, DocumentEvent.FAILURE);
                    doc.setErrorMessage(message);
                    documentRepository.save(doc);
                    log.error("Ingestion of document {} failed: {}", documentId, message, error);
                    report.addStep("failed", message);
                    return report.setStatus(DocumentStatus.FAILED).setErrorMessage(message);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static void transition(DocumentEntity doc, DocumentEvent event) {
        doc.setStatus(doc.getStatus().next(event));
    }

    private static boolean marksFailure(Throwable error) {
        return !(error instanceof TimeoutException)
                && !(error instanceof NotFoundException)
                && !(error instanceof ConflictException);
    }
}
