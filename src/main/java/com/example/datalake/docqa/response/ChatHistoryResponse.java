package com.example.datalake.docqa.response;

import com.example.datalake.docqa.entity.ChatHistoryEntity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ChatHistoryResponse(
        UUID id,
        String question,
        String answer,
        String role,
        List<UUID> sources,
        Instant createdAt
) {

    public static ChatHistoryResponse from(ChatHistoryEntity entity) {
        return new ChatHistoryResponse(entity.getId(), entity.getQuestion(), entity.getAnswer(),
                entity.getRole().code(), entity.getSources(), entity.getCreatedAt());
    }
}
