package com.example.datalake.docqa.exception;

import java.util.List;

/** Error body returned by every endpoint. */
public record ApiError(String code, String message, String path, List<String> details) {
}
