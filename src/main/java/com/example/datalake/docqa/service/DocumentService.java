package com.example.datalake.docqa.service;

import com.example.datalake.docqa.dao.ChunkStore;
import com.example.datalake.docqa.dao.DocumentRepository;
import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.exception.IngestionInProgressException;
import com.example.datalake.docqa.exception.NotFoundException;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.validation.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.EnumSet;
import java.util.UUID;

/** Registry of uploaded documents. Ingestion itself lives in {@link IngestionPipeline}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentRepository repository;
    private final ChunkStore chunkStore;
    private final IngestionPipeline ingestionPipeline;

    @Transactional
    public DocumentEntity register(String filename, String mediaType, long fileSize, Collection<RoleTag> visibleTo) {
        if (!StringUtils.hasText(filename)) {
            throw new ValidationException("Filename is required.");
        }
        if (fileSize < 0) {
            throw new ValidationException("File size must not be negative.");
        }

        EnumSet<RoleTag> roles = EnumSet.of(RoleTag.OWNER);
        if (visibleTo != null) {
            roles.addAll(visibleTo);
        }
        UUID id = UUID.randomUUID();
        DocumentEntity entity = DocumentEntity.builder()
                .id(id)
                .filename(filename.trim())
                .mediaType(StringUtils.hasText(mediaType) ? mediaType.trim() : "application/octet-stream")
                .fileSize(fileSize)
                .storagePath("documents/" + id + "/" + filename.trim())
                .status(DocumentStatus.PROCESSING)
                .visibleTo(roles)
                .build();
        DocumentEntity saved = repository.save(entity);
        log.info("Registered document {} ({})", id, entity.getFilename());
        return saved == null ? entity : saved;
    }

    public DocumentEntity get(UUID id) {
        return repository.findById(id).orElseThrow(() -> NotFoundException.document(id));
    }

    public Page<DocumentEntity> list(DocumentStatus status, Pageable pageable) {
        if (status == null) {
            return repository.findAll(pageable);
        }
        return repository.findByStatus(status, pageable);
    }

    @Transactional
    public DocumentEntity updateVisibility(UUID id, Collection<RoleTag> visibleTo) {
        DocumentEntity entity = get(id);
        EnumSet<RoleTag> roles = EnumSet.of(RoleTag.OWNER);
        if (visibleTo != null) {
            roles.addAll(visibleTo);
        }
        entity.setVisibleTo(roles);
        DocumentEntity saved = repository.save(entity);
        log.info("Document {} visible to {}", id, roles);
        return saved == null ? entity : saved;
    }

    @Transactional
    public void delete(UUID id) {
        DocumentEntity entity = get(id);
        if (ingestionPipeline.isRunning(id)) {
            throw new IngestionInProgressException(id);
        }
        chunkStore.deleteByDocument(id);
        repository.delete(entity);
        log.info("Deleted document {} and its chunks", id);
    }
}
