package com.example.datalake.docqa.response;

import com.example.datalake.docqa.entity.CustomerQueryEntity;

import java.time.Instant;
import java.util.UUID;

public record CustomerQueryResponse(
        UUID id,
        String question,
        String customerName,
        String customerEmail,
        String status,
        Instant createdAt,
        Instant updatedAt
) {

    public static CustomerQueryResponse from(CustomerQueryEntity entity) {
        return new CustomerQueryResponse(entity.getId(), entity.getQuestion(), entity.getCustomerName(),
                entity.getCustomerEmail(), entity.getStatus().code(), entity.getCreatedAt(), entity.getUpdatedAt());
    }
}
