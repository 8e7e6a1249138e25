package com.example.datalake.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.datalake.docqa.dao.ChunkStore;
import com.example.datalake.docqa.dao.DocumentRepository;
import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.exception.IngestionInProgressException;
import com.example.datalake.docqa.exception.NotFoundException;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.support.TestDocuments;
import com.example.datalake.docqa.validation.ValidationException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DocumentServiceTest {

  private final ChunkStore chunkStore = mock(ChunkStore.class);
  private final IngestionPipeline pipeline = mock(IngestionPipeline.class);

  @Test
  void registerAlwaysIncludesOwner() {
    DocumentRepository repository = mock(DocumentRepository.class);
    when(repository.save(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    DocumentService service = new DocumentService(repository, chunkStore, pipeline);

    DocumentEntity doc = service.register(" menu.txt ", "text/plain", 512, List.of(RoleTag.EXTERNAL));

    assertThat(doc.getId()).isNotNull();
    assertThat(doc.getFilename()).isEqualTo("menu.txt");
    assertThat(doc.getStatus()).isEqualTo(DocumentStatus.PROCESSING);
    assertThat(doc.getVisibleTo()).containsExactlyInAnyOrder(RoleTag.OWNER, RoleTag.EXTERNAL);
    assertThat(doc.getStoragePath()).isEqualTo("documents/" + doc.getId() + "/menu.txt");
  }

  @Test
  void registerWithoutRolesIsOwnerOnly() {
    DocumentRepository repository = mock(DocumentRepository.class);
    when(repository.save(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    DocumentService service = new DocumentService(repository, chunkStore, pipeline);

    DocumentEntity doc = service.register("notes.md", null, 10, null);

    assertThat(doc.getVisibleTo()).containsExactly(RoleTag.OWNER);
    assertThat(doc.getMediaType()).isEqualTo("application/octet-stream");
  }

  @Test
  void registerRejectsMissingFilename() {
    DocumentService service = new DocumentService(mock(DocumentRepository.class), chunkStore, pipeline);

    assertThatThrownBy(() -> service.register("  ", "text/plain", 1, null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void visibilityUpdateCannotRemoveOwner() {
    DocumentEntity doc = TestDocuments.document(DocumentStatus.COMPLETED, RoleTag.STAFF, RoleTag.EXTERNAL);
    DocumentService service = new DocumentService(TestDocuments.repositoryFor(doc), chunkStore, pipeline);

    DocumentEntity updated = service.updateVisibility(doc.getId(), List.of(RoleTag.STAFF));

    assertThat(updated.getVisibleTo()).containsExactlyInAnyOrder(RoleTag.OWNER, RoleTag.STAFF);
  }

  @Test
  void deleteRemovesChunksAndDocument() {
    DocumentEntity doc = TestDocuments.document(DocumentStatus.COMPLETED);
    DocumentRepository repository = TestDocuments.repositoryFor(doc);
    DocumentService service = new DocumentService(repository, chunkStore, pipeline);

    service.delete(doc.getId());

    verify(chunkStore).deleteByDocument(doc.getId());
    verify(repository).delete(doc);
  }

  @Test
  void deleteIsRefusedWhileIngesting() {
    DocumentEntity doc = TestDocuments.document(DocumentStatus.PROCESSING);
    DocumentRepository repository = TestDocuments.repositoryFor(doc);
    when(pipeline.isRunning(doc.getId())).thenReturn(true);
    DocumentService service = new DocumentService(repository, chunkStore, pipeline);

    assertThatThrownBy(() -> service.delete(doc.getId())).isInstanceOf(IngestionInProgressException.class);
    verify(chunkStore, never()).deleteByDocument(any());
    verify(repository, never()).delete(any(DocumentEntity.class));
  }

  @Test
  void getUnknownDocumentFails() {
    DocumentRepository repository = mock(DocumentRepository.class);
    UUID id = UUID.randomUUID();
    when(repository.findById(id)).thenReturn(Optional.empty());
    DocumentService service = new DocumentService(repository, chunkStore, pipeline);

    assertThatThrownBy(() -> service.get(id))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(id.toString());
  }
}
