package com.example.datalake.docqa.support;

import com.example.datalake.docqa.dao.DocumentRepository;
import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

public final class TestDocuments {

  private TestDocuments() {
  }

  public static DocumentEntity document(DocumentStatus status, RoleTag... visibleTo) {
    EnumSet<RoleTag> roles = EnumSet.of(RoleTag.OWNER);
    roles.addAll(java.util.List.of(visibleTo));
    return DocumentEntity.builder()
        .id(UUID.randomUUID())
        .filename("handbook.txt")
        .mediaType("text/plain")
        .fileSize(128)
        .status(status)
        .visibleTo(roles)
        .createdAt(Instant.EPOCH)
        .updatedAt(Instant.EPOCH)
        .build();
  }

  /** Repository mock that serves the given entity by id and echoes saves. */
  public static DocumentRepository repositoryFor(DocumentEntity doc) {
    DocumentRepository repository = mock(DocumentRepository.class);
    lenient().when(repository.findById(doc.getId())).thenReturn(Optional.of(doc));
    lenient().when(repository.save(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    return repository;
  }
}
