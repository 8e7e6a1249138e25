package com.example.datalake.docqa.service;

import com.example.datalake.docqa.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Thin wrapper over the configured {@link EmbeddingModel} with a domain failure type. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final EmbeddingModel embeddingModel;

    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text to embed must not be blank");
        }
        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            log.warn("Embedding request failed – {}", e.getMessage());
            throw new EmbeddingUnavailableException("Failed to generate embedding", e);
        }
        if (response == null || response.content() == null || response.content().vector().length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned no vector", null);
        }
        return response.content().vector();
    }
}
