package com.example.datalake.docqa.exception;

import com.example.datalake.docqa.model.DocumentEvent;
import com.example.datalake.docqa.model.DocumentStatus;

public class InvalidStatusTransitionException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public InvalidStatusTransitionException(DocumentStatus from, DocumentEvent event) {
        super("Event %s is not allowed in status %s".formatted(event, from.code()));
    }
}
