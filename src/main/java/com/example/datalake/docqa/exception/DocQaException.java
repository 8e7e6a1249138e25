package com.example.datalake.docqa.exception;

/** Root of the domain exceptions; each carries the {@link ErrorCode} the API reports. */
public class DocQaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    public DocQaException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DocQaException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() { return errorCode; }
}
