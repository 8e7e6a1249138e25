package com.example.datalake.docqa.exception;

public class UnsupportedMediaTypeException extends UpstreamUnavailableException {

    private static final long serialVersionUID = 1L;

    public UnsupportedMediaTypeException(String mediaType) {
        super(ErrorCode.UNSUPPORTED_MEDIA_TYPE, "Unsupported file type: " + mediaType);
    }
}
