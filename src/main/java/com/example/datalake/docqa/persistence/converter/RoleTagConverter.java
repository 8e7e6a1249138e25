package com.example.datalake.docqa.persistence.converter;

import com.example.datalake.docqa.model.RoleTag;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RoleTagConverter implements AttributeConverter<RoleTag, String> {

    @Override
    public String convertToDatabaseColumn(RoleTag attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public RoleTag convertToEntityAttribute(String dbData) {
        return dbData == null ? null : RoleTag.fromCode(dbData);
    }
}
