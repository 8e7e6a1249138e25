package com.example.datalake.docqa.service;

import com.example.datalake.docqa.exception.ExtractionFailedException;
import com.example.datalake.docqa.exception.UnsupportedMediaTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts {@code text/*} and CSV uploads as UTF-8. Binary office formats and PDFs are not handled.
 */
@Slf4j
@Service
public class PlainTextExtractionService implements ExtractionService {

    private static final Set<String> EXTRA_TYPES = Set.of("application/csv", "application/json");

    @Override
    public boolean supports(String mediaType) {
        if (mediaType == null || mediaType.isBlank()) {
            return false;
        }
        String normalized = baseType(mediaType);
        return normalized.startsWith("text/") || EXTRA_TYPES.contains(normalized);
    }

    @Override
    public String extract(byte[] content, String mediaType) {
        if (!supports(mediaType)) {
            throw new UnsupportedMediaTypeException(mediaType);
        }
        if (content == null) {
            throw new ExtractionFailedException("No content to extract");
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            // strip a UTF-8 byte order mark
            if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                text = text.substring(1);
            }
            log.debug("Extracted {} chars from {} bytes of {}", text.length(), content.length, mediaType);
            return text;
        } catch (CharacterCodingException e) {
            throw new ExtractionFailedException("File is not valid UTF-8 text", e);
        }
    }

    private static String baseType(String mediaType) {
        int semicolon = mediaType.indexOf(';');
        String base = semicolon >= 0 ? mediaType.substring(0, semicolon) : mediaType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
