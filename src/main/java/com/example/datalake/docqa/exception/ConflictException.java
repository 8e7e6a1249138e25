package com.example.datalake.docqa.exception;

public class ConflictException extends DocQaException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
