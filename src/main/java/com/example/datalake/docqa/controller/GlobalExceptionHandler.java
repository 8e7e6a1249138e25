package com.example.datalake.docqa.controller;

import com.example.datalake.docqa.exception.ApiError;
import com.example.datalake.docqa.exception.DocQaException;
import com.example.datalake.docqa.exception.ErrorCode;
import com.example.datalake.docqa.validation.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException ex, HttpServletRequest req) {
        log.debug("[VALIDATION] {} - {}", req.getRequestURI(), ex.getReasons());
        return build(ErrorCode.VALIDATION_ERROR, "Validation failed", req, ex.getReasons());
    }

    @ExceptionHandler(DocQaException.class)
    public ResponseEntity<ApiError> handleDomain(DocQaException ex, HttpServletRequest req) {
        ErrorCode code = ex.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.warn("[UPSTREAM] {} - {}", req.getRequestURI(), ex.getMessage());
        } else {
            log.debug("[DOMAIN] {} - {}", req.getRequestURI(), ex.getMessage());
        }
        return build(code, ex.getMessage(), req, List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest req) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        log.debug("[VALIDATION] {} - {}", req.getRequestURI(), details);
        return build(ErrorCode.VALIDATION_ERROR, "Validation failed", req, details);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadArgument(Exception ex, HttpServletRequest req) {
        log.debug("[BAD-ARGUMENT] {} - {}", req.getRequestURI(), ex.getMessage());
        return build(ErrorCode.VALIDATION_ERROR, ex.getMessage(), req, List.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        log.debug("[NOT-READABLE] {} - {}", req.getRequestURI(), ex.getMessage());
        return build(ErrorCode.VALIDATION_ERROR, "Malformed JSON request", req, List.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException ex, HttpServletRequest req) {
        log.error("[DATA-ACCESS] {} - {}", req.getRequestURI(), summarize(ex));
        return build(ErrorCode.INTERNAL_ERROR, "Database access error", req, List.of());
    }

    private ResponseEntity<ApiError> build(ErrorCode code, String message, HttpServletRequest req, List<String> details) {
        ApiError body = new ApiError(code.getCode(), message, req.getRequestURI(), details == null ? List.of() : details);
        return ResponseEntity.status(code.getStatus()).body(body);
    }

    private String summarize(Throwable t) {
        String msg = t.getMessage();
        if (msg == null) return t.getClass().getSimpleName();
        return msg.length() > 1000 ? msg.substring(0, 1000) + "..." : msg;
    }
}
