package com.example.datalake.docqa.exception;

import java.util.UUID;

public class NotFoundException extends DocQaException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException document(UUID id) {
        return new NotFoundException("Document %s not found".formatted(id));
    }
}
