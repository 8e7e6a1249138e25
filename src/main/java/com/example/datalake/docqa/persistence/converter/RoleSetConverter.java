package com.example.datalake.docqa.persistence.converter;

import com.example.datalake.docqa.model.RoleTag;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores a document's visibility set as comma separated role codes, e.g.
 * {@code business_owner,customer}.
 */
@Converter
public class RoleSetConverter implements AttributeConverter<Set<RoleTag>, String> {

    @Override
    public String convertToDatabaseColumn(Set<RoleTag> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(attribute).stream()
                .map(RoleTag::code)
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<RoleTag> convertToEntityAttribute(String dbData) {
        EnumSet<RoleTag> roles = EnumSet.noneOf(RoleTag.class);
        if (dbData == null || dbData.isBlank()) {
            return roles;
        }
        Arrays.stream(dbData.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(RoleTag::fromCode)
                .forEach(roles::add);
        return roles;
    }
}
