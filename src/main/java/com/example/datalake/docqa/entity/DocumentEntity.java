package com.example.datalake.docqa.entity;

import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.persistence.converter.RoleSetConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Uploaded document and its ingestion status. Chunks and embeddings reference it with
 * {@code ON DELETE CASCADE}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
@Entity
@Table(name = "documents", schema = "public")
public class DocumentEntity {

    @Id
    private UUID id;

    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "file_type", nullable = false, length = 200)
    private String mediaType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "storage_path", length = 1000)
    private String storagePath;

    @Column(name = "status", nullable = false, length = 32)
    private DocumentStatus status;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Convert(converter = RoleSetConverter.class)
    @Column(name = "visible_to", nullable = false)
    @Builder.Default
    private Set<RoleTag> visibleTo = EnumSet.of(RoleTag.OWNER);

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isVisibleTo(RoleTag role) {
        return role == RoleTag.OWNER || (visibleTo != null && visibleTo.contains(role));
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        ensureOwnerVisible();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
        ensureOwnerVisible();
    }

    private void ensureOwnerVisible() {
        EnumSet<RoleTag> roles = EnumSet.of(RoleTag.OWNER);
        if (visibleTo != null) {
            roles.addAll(visibleTo);
        }
        visibleTo = roles;
    }
}
