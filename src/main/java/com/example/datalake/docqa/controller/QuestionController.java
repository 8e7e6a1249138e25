package com.example.datalake.docqa.controller;

import com.example.datalake.docqa.exception.UpstreamUnavailableException;
import com.example.datalake.docqa.model.AnswerResult;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.request.AskQuestionRequest;
import com.example.datalake.docqa.response.AnswerResponse;
import com.example.datalake.docqa.response.ChatHistoryResponse;
import com.example.datalake.docqa.service.ChatHistoryService;
import com.example.datalake.docqa.service.QuestionAnsweringService;
import com.example.datalake.docqa.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/questions")
@Tag(name = "Questions", description = "Ask questions against the ingested documents")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionAnsweringService questionAnsweringService;
    private final ChatHistoryService chatHistoryService;

    @PostMapping
    @Operation(
            summary = "Answer a question",
            description = "Uses the answer cache when a similar question was answered for the same role, "
                    + "otherwise runs hybrid search and grounded generation. noAnswer=true means the documents "
                    + "could not answer the question."
    )
    public Mono<ResponseEntity<AnswerResponse>> ask(@RequestBody AskQuestionRequest req) {
        RoleTag role;
        try {
            role = req.getRole() == null || req.getRole().isBlank() ? RoleTag.EXTERNAL : RoleTag.fromCode(req.getRole());
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().body(errorResponse(req, List.of(e.getMessage()))));
        }

        return questionAnsweringService.ask(req.getQuestion(), role)
                .map(result -> ResponseEntity.ok(toResponse(result)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(errorResponse(req, ex.getReasons()))))
                .onErrorResume(UpstreamUnavailableException.class, ex -> {
                    log.warn("Upstream failure while answering – {}", ex.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(errorResponse(req, List.of(ex.getMessage()))));
                })
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while answering question", ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(errorResponse(req, List.of(unexpectedMessage(ex)))));
                });
    }

    @GetMapping("/history")
    @Operation(summary = "Most recent questions and answers of non-customer roles")
    public List<ChatHistoryResponse> history(@RequestParam(required = false) String role,
                                             @RequestParam(defaultValue = "50") int limit) {
        RoleTag filter = role == null || role.isBlank() ? null : RoleTag.fromCode(role);
        return chatHistoryService.recent(filter, limit).stream().map(ChatHistoryResponse::from).toList();
    }

    private AnswerResponse toResponse(AnswerResult result) {
        return AnswerResponse.builder()
                .question(result.getQuestion())
                .role(result.getRole().code())
                .answer(result.getAnswer())
                .sources(result.getSources())
                .fromCache(result.isFromCache())
                .cacheHitCount(result.getCacheHitCount())
                .noAnswer(result.isNoAnswer())
                .errors(List.of())
                .build();
    }

    private AnswerResponse errorResponse(AskQuestionRequest req, List<String> errors) {
        return AnswerResponse.builder()
                .question(req.getQuestion())
                .role(req.getRole())
                .sources(List.of())
                .errors(List.copyOf(errors))
                .build();
    }

    private static String unexpectedMessage(Throwable ex) {
        String detail = ex.getMessage();
        return detail == null || detail.isBlank() ? "Unexpected error occurred." : "Unexpected error: " + detail;
    }
}
