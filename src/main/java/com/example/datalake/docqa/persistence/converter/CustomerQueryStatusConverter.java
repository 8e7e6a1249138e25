package com.example.datalake.docqa.persistence.converter;

import com.example.datalake.docqa.model.CustomerQueryStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class CustomerQueryStatusConverter implements AttributeConverter<CustomerQueryStatus, String> {

    @Override
    public String convertToDatabaseColumn(CustomerQueryStatus attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public CustomerQueryStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : CustomerQueryStatus.fromCode(dbData);
    }
}
