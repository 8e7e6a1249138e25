package com.example.datalake.docqa.service;

import com.example.datalake.docqa.dao.DocumentRepository;
import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.RoleTag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/** Only completed documents take part in retrieval; the owner sees all of them. */
@Service
@RequiredArgsConstructor
public class DocumentAccessFilter implements AccessFilterProvider {

    private final DocumentRepository documentRepository;

    @Override
    public Set<UUID> visibleDocumentIds(RoleTag role) {
        return documentRepository.findByStatus(DocumentStatus.COMPLETED).stream()
                .filter(doc -> doc.isVisibleTo(role))
                .map(DocumentEntity::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
