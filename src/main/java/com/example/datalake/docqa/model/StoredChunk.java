package com.example.datalake.docqa.model;

import java.util.UUID;

public record StoredChunk(UUID id, UUID documentId, int chunkIndex, String content) {
}
