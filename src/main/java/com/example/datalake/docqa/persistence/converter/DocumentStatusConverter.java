package com.example.datalake.docqa.persistence.converter;

import com.example.datalake.docqa.model.DocumentStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class DocumentStatusConverter implements AttributeConverter<DocumentStatus, String> {

    @Override
    public String convertToDatabaseColumn(DocumentStatus attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public DocumentStatus convertToEntityAttribute(String dbData) {
        return DocumentStatus.fromCode(dbData);
    }
}
