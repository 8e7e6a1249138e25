package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.entity.ChatHistoryEntity;
import com.example.datalake.docqa.model.RoleTag;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ChatHistoryRepository extends JpaRepository<ChatHistoryEntity, UUID> {

    Page<ChatHistoryEntity> findByRoleOrderByCreatedAtDesc(RoleTag role, Pageable pageable);
}
