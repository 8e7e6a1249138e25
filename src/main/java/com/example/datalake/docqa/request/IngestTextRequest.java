package com.example.datalake.docqa.request;

import jakarta.validation.constraints.NotBlank;

public record IngestTextRequest(@NotBlank(message = "Text is required") String text) {
}
