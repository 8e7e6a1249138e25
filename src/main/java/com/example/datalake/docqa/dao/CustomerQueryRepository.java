package com.example.datalake.docqa.dao;

import com.example.datalake.docqa.entity.CustomerQueryEntity;
import com.example.datalake.docqa.model.CustomerQueryStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface CustomerQueryRepository extends JpaRepository<CustomerQueryEntity, UUID> {

    Page<CustomerQueryEntity> findByStatus(CustomerQueryStatus status, Pageable pageable);
}
