package com.example.datalake.docqa.service;

/** Turns an uploaded file into plain text for chunking. */
public interface ExtractionService {

    boolean supports(String mediaType);

    /**
     * @throws com.example.datalake.docqa.exception.UnsupportedMediaTypeException when the type is not handled
     * @throws com.example.datalake.docqa.exception.ExtractionFailedException      when the bytes cannot be read
     */
    String extract(byte[] content, String mediaType);
}
