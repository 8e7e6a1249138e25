package com.example.datalake.docqa.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(Langchain4jOpenAiProperties.class)
public class Langchain4jConfig {

    @Bean
    public ChatModel chatModel(Langchain4jOpenAiProperties props) {
        return OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getChatModel())
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxOutputTokens())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(Langchain4jOpenAiProperties props) {
        // 384 dimensions, matching the vector columns in db/schema.sql
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            log.info("No OpenAI api key configured, using local all-MiniLM-L6-v2 embeddings");
            return new AllMiniLmL6V2EmbeddingModel();
        }

        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .dimensions(props.getEmbeddingDimensions())
                .build();
    }
}
