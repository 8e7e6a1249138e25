package com.example.datalake.docqa.exception;

/** An external capability (extraction, embedding, generation) failed. */
public class UpstreamUnavailableException extends DocQaException {

    private static final long serialVersionUID = 1L;

    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }

    protected UpstreamUnavailableException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
