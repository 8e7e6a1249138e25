package com.example.datalake.docqa.exception;

public class ExtractionFailedException extends UpstreamUnavailableException {

    private static final long serialVersionUID = 1L;

    public ExtractionFailedException(String reason) {
        super(reason);
    }

    public ExtractionFailedException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
