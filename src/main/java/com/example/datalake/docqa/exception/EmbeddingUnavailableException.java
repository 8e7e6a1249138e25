package com.example.datalake.docqa.exception;

public class EmbeddingUnavailableException extends UpstreamUnavailableException {

    private static final long serialVersionUID = 1L;

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
