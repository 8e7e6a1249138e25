package com.example.datalake.docqa.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record RegisterDocumentRequest(
        @NotBlank(message = "Filename is required") String filename,
        String mediaType,
        @PositiveOrZero(message = "File size must not be negative") long fileSize,
        List<String> visibleTo
) {
}
