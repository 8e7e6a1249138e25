package com.example.datalake.docqa.service;

import com.example.datalake.docqa.dao.ChatHistoryRepository;
import com.example.datalake.docqa.entity.ChatHistoryEntity;
import com.example.datalake.docqa.model.RoleTag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatHistoryService {

    private static final int MAX_RECENT = 200;

    private final ChatHistoryRepository repository;

    @Transactional
    public ChatHistoryEntity record(String question, String answer, RoleTag role, List<UUID> sourceDocumentIds) {
        ChatHistoryEntity entity = new ChatHistoryEntity()
                .setQuestion(question)
                .setAnswer(answer)
                .setRole(role)
                .setSources(sourceDocumentIds == null ? new ArrayList<>() : new ArrayList<>(sourceDocumentIds));
        ChatHistoryEntity saved = repository.save(entity);
        log.debug("Recorded chat history for role {}", role.code());
        return saved;
    }

    public List<ChatHistoryEntity> recent(RoleTag role, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        if (role == null) {
            return repository.findAll(PageRequest.of(0, size, Sort.by(Sort.Direction.DESC, "createdAt"))).getContent();
        }
        return repository.findByRoleOrderByCreatedAtDesc(role, PageRequest.of(0, size)).getContent();
    }
}
