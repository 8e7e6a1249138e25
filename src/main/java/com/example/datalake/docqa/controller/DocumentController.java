package com.example.datalake.docqa.controller;

import com.example.datalake.docqa.entity.DocumentEntity;
import com.example.datalake.docqa.exception.ExtractionFailedException;
import com.example.datalake.docqa.model.DocumentStatus;
import com.example.datalake.docqa.model.IngestionReport;
import com.example.datalake.docqa.model.RoleTag;
import com.example.datalake.docqa.request.IngestTextRequest;
import com.example.datalake.docqa.request.RegisterDocumentRequest;
import com.example.datalake.docqa.request.VisibilityRequest;
import com.example.datalake.docqa.response.DocumentResponse;
import com.example.datalake.docqa.response.PageResponse;
import com.example.datalake.docqa.service.DocumentService;
import com.example.datalake.docqa.service.IngestionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
@Tag(name = "Documents", description = "Register documents and run ingestion")
public class DocumentController {

    private final DocumentService documentService;
    private final IngestionPipeline ingestionPipeline;

    @Operation(summary = "Register a document; it starts in status processing")
    @PostMapping
    public ResponseEntity<DocumentResponse> register(@Valid @RequestBody RegisterDocumentRequest request) {
        DocumentEntity doc = documentService.register(request.filename(), request.mediaType(), request.fileSize(),
                parseRoles(request.visibleTo()));
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(doc));
    }

    @Operation(summary = "List documents, optionally filtered by status")
    @GetMapping
    public PageResponse<DocumentResponse> list(@RequestParam(required = false) String status,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        DocumentStatus filter = status == null || status.isBlank() ? null : DocumentStatus.fromCode(status);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return PageResponse.from(documentService.list(filter, pageable), DocumentResponse::from);
    }

    @Operation(summary = "Get a document by id")
    @GetMapping("/{id}")
    public DocumentResponse get(@PathVariable UUID id) {
        return DocumentResponse.from(documentService.get(id));
    }

    @Operation(summary = "Replace the roles a document is visible to; the owner always keeps access")
    @PutMapping("/{id}/visibility")
    public DocumentResponse updateVisibility(@PathVariable UUID id, @Valid @RequestBody VisibilityRequest request) {
        return DocumentResponse.from(documentService.updateVisibility(id, parseRoles(request.visibleTo())));
    }

    @Operation(summary = "Delete a document with its chunks and embeddings")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        documentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Ingest already extracted text")
    @PostMapping("/{id}/ingest")
    public Mono<ResponseEntity<IngestionReport>> ingestText(@PathVariable UUID id,
                                                            @Valid @RequestBody IngestTextRequest request) {
        return ingestionPipeline.ingestText(id, request.text()).map(ResponseEntity::ok);
    }

    @Operation(summary = "Upload a text file and ingest it")
    @PostMapping(value = "/{id}/content", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<IngestionReport>> ingestFile(@PathVariable UUID id,
                                                            @RequestPart("file") MultipartFile file) {
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new ExtractionFailedException("Unable to read uploaded file", e);
        }
        String mediaType = file.getContentType() == null ? documentService.get(id).getMediaType() : file.getContentType();
        return ingestionPipeline.ingestFile(id, bytes, mediaType).map(ResponseEntity::ok);
    }

    @Operation(summary = "Resume ingestion from the first incomplete step")
    @PostMapping("/{id}/retry")
    public Mono<ResponseEntity<IngestionReport>> retry(@PathVariable UUID id) {
        return ingestionPipeline.resume(id).map(ResponseEntity::ok);
    }

    static Set<RoleTag> parseRoles(List<String> codes) {
        EnumSet<RoleTag> roles = EnumSet.noneOf(RoleTag.class);
        if (codes != null) {
            codes.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(RoleTag::fromCode)
                    .forEach(roles::add);
        }
        return roles;
    }
}
