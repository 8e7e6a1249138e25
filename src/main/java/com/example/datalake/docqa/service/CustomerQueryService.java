package com.example.datalake.docqa.service;

import com.example.datalake.docqa.dao.CustomerQueryRepository;
import com.example.datalake.docqa.entity.CustomerQueryEntity;
import com.example.datalake.docqa.exception.NotFoundException;
import com.example.datalake.docqa.model.CustomerQueryStatus;
import com.example.datalake.docqa.validation.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/** Captures questions an external caller could not get answered, for a human follow-up. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerQueryService {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final CustomerQueryRepository repository;

    @Transactional
    public CustomerQueryEntity capture(String question, String customerName, String customerEmail) {
        List<String> reasons = new ArrayList<>();
        if (!StringUtils.hasText(question)) {
            reasons.add("Question must not be blank.");
        }
        if (!StringUtils.hasText(customerName)) {
            reasons.add("Name must not be blank.");
        }
        if (!StringUtils.hasText(customerEmail) || !EMAIL.matcher(customerEmail.trim()).matches()) {
            reasons.add("A valid email address is required.");
        }
        if (!reasons.isEmpty()) {
            throw new ValidationException(reasons);
        }

        CustomerQueryEntity entity = new CustomerQueryEntity()
                .setQuestion(question.trim())
                .setCustomerName(customerName.trim())
                .setCustomerEmail(customerEmail.trim())
                .setStatus(CustomerQueryStatus.PENDING);
        CustomerQueryEntity saved = repository.save(entity);
        log.info("Captured customer query {}", saved.getId());
        return saved;
    }

    public Page<CustomerQueryEntity> list(CustomerQueryStatus status, Pageable pageable) {
        if (status == null) {
            return repository.findAll(pageable);
        }
        return repository.findByStatus(status, pageable);
    }

    public CustomerQueryEntity get(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Customer query %s not found".formatted(id)));
    }

    @Transactional
    public CustomerQueryEntity updateStatus(UUID id, CustomerQueryStatus status) {
        if (status == null) {
            throw new ValidationException("Status is required.");
        }
        CustomerQueryEntity entity = get(id);
        CustomerQueryStatus previous = entity.getStatus();
        entity.setStatus(status);
        CustomerQueryEntity saved = repository.save(entity);
        log.info("Customer query {} moved from {} to {}", id, previous.code(), status.code());
        return saved;
    }
}
