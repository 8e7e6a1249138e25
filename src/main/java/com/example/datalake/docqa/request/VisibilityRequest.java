package com.example.datalake.docqa.request;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record VisibilityRequest(@NotNull(message = "visibleTo is required") List<String> visibleTo) {
}
