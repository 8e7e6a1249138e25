package com.example.datalake.docqa.response;

import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.model.RoleTag;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record DocumentResponse(
        UUID id,
        String filename,
        String mediaType,
        long fileSize,
        String status,
        String errorMessage,
        List<String> visibleTo,
        Instant createdAt,
        Instant updatedAt
) {

    public static DocumentResponse from(DocumentEntity doc) {
        List<String> roles = doc.getVisibleTo() == null ? List.of() : doc.getVisibleTo().stream()
                .sorted()
                .map(RoleTag::code)
                .toList();
        return new DocumentResponse(doc.getId(), doc.getFilename(), doc.getMediaType(), doc.getFileSize(),
                doc.getStatus() == null ? null : doc.getStatus().code(), doc.getErrorMessage(), roles,
                doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
