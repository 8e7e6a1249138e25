package com.example.datalake.docqa.entity;

import com.example.datalake.docqa.model.CustomerQueryStatus;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.UUID;

/** External-role question that could not be answered, kept with contact details. */
@Data
@Accessors(chain = true)
@Entity
@Table(name = "customer_queries", schema = "public")
public class CustomerQueryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @Column(name = "status", nullable = false, length = 20)
    private CustomerQueryStatus status = CustomerQueryStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
