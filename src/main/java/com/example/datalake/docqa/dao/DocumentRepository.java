package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.model.DocumentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DocumentRepository extends JpaRepository<DocumentEntity, UUID> {

    List<DocumentEntity> findByStatus(DocumentStatus status);

    Page<DocumentEntity> findByStatus(DocumentStatus status, Pageable pageable);
}
