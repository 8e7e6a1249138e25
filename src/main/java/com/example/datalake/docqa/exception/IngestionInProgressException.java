package com.example.datalake.docqa.exception;

import java.util.UUID;

/** Another ingestion run already holds the document. */
public class IngestionInProgressException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public IngestionInProgressException(UUID documentId) {
        super("Ingestion already running for document " + documentId);
    }
}
