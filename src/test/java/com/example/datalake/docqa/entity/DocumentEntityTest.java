package com.example.datalake.docqa.entity;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class DocumentEntityTest {

  @Test
  void ownerIsAddedBeforeInsert() {
    DocumentEntity doc = new DocumentEntity()
        .setFilename("faq.txt")
        .setMediaType("text/plain")
        .setStatus(DocumentStatus.PROCESSING)
        .setVisibleTo(EnumSet.of(RoleTag.EXTERNAL));

    doc.onCreate();

    assertThat(doc.getId()).isNotNull();
    assertThat(doc.getCreatedAt()).isNotNull();
    assertThat(doc.getVisibleTo()).containsExactlyInAnyOrder(RoleTag.OWNER, RoleTag.EXTERNAL);
  }

  @Test
  void ownerIsRestoredOnUpdate() {
    DocumentEntity doc = new DocumentEntity().setVisibleTo(null);

    doc.onUpdate();

    assertThat(doc.getVisibleTo()).containsExactly(RoleTag.OWNER);
    assertThat(doc.getUpdatedAt()).isNotNull();
  }

  @Test
  void ownerSeesEverythingOthersNeedTheTag() {
    DocumentEntity doc = new DocumentEntity().setVisibleTo(EnumSet.of(RoleTag.STAFF));

    assertThat(doc.isVisibleTo(RoleTag.OWNER)).isTrue();
    assertThat(doc.isVisibleTo(RoleTag.STAFF)).isTrue();
    assertThat(doc.isVisibleTo(RoleTag.EXTERNAL)).isFalse();
  }
}
