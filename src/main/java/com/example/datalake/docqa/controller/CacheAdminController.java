package com.example.datalake.docqa.controller;

import com.example.datalake.docqa.service.AnswerCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
@Tag(name = "Answer Cache", description = "Maintenance of the answer cache")
public class CacheAdminController {

    private final AnswerCacheService answerCacheService;

    @Operation(summary = "Prune old, rarely hit cache entries now")
    @PostMapping("/prune")
    public Map<String, Integer> prune() {
        return Map.of("removed", answerCacheService.prune());
    }
}
