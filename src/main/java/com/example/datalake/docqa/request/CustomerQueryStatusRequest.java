package com.example.datalake.docqa.request;

import jakarta.validation.constraints.NotBlank;

public record CustomerQueryStatusRequest(@NotBlank(message = "Status is required") String status) {
}
