package com.example.datalake.docqa.persistence.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JSON array of document ids, used for chat history sources. */
@Converter
public class UuidListConverter implements AttributeConverter<List<UUID>, String> {

    private static final Logger log = LoggerFactory.getLogger(UuidListConverter.class);
    private static final TypeReference<List<UUID>> LIST_OF_UUID = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<UUID> attribute) {
        try {
            return objectMapper.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize source ids, storing empty list", e);
            return "[]";
        }
    }

    @Override
    public List<UUID> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(dbData, LIST_OF_UUID);
        } catch (IOException e) {
            log.warn("Unable to deserialize source ids JSON, returning empty list", e);
            return Collections.emptyList();
        }
    }
}
