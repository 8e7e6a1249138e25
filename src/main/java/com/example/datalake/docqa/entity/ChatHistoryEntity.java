package com.example.datalake.docqa.entity;

import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.persistence.converter.RoleTagConverter;
import com.example.datalake.docqa.persistence.converter.UuidListConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "chat_history", schema = "public")
public class ChatHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Column(name = "answer", nullable = false, columnDefinition = "text")
    private String answer;

    @Convert(converter = RoleTagConverter.class)
    @Column(name = "role", nullable = false, length = 20)
    private RoleTag role;

    @Convert(converter = UuidListConverter.class)
    @Column(name = "sources", nullable = false, columnDefinition = "text")
    private List<UUID> sources = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
