package com.example.datalake.docqa.exception;

public class GenerationUnavailableException extends UpstreamUnavailableException {

    private static final long serialVersionUID = 1L;

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
