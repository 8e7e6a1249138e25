package com.example.datalake.docqa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.chat-model=...
 * langchain4j.openai.embedding-model=...
 * langchain4j.openai.temperature=0.2
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key. When blank, embeddings fall back to the local all-MiniLM-L6-v2 model.
     */
    private String apiKey;

    /**
     * Chat model name, e.g. "gpt-4o-mini"
     */
    private String chatModel = "gpt-4o-mini";

    /**
     * Embedding model name, e.g. "text-embedding-3-small"
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Requested embedding size; must match the vector(384) columns of the schema.
     */
    private Integer embeddingDimensions = 384;

    private double temperature = 0.2;

    private Integer maxOutputTokens = 1024;
}
