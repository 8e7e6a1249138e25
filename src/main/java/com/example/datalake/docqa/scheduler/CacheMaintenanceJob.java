package com.example.datalake.docqa.scheduler;

import com.example.datalake.docqa.service.AnswerCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final AnswerCacheService answerCacheService;

    @Scheduled(cron = "${docqa.rag.cache.prune-cron:0 30 3 * * *}")
    public void pruneStaleEntries() {
        try {
            answerCacheService.prune();
        } catch (DataAccessException e) {
            log.error("Scheduled cache pruning failed", e);
        }
    }
}
