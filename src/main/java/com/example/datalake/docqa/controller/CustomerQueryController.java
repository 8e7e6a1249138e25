package com.example.datalake.docqa.controller;

import com.example.datalake.docqa.model.CustomerQueryStatus;
import com.example.datalake.docqa.request.CustomerQueryRequest;
import com.example.datalake.docqa.request.CustomerQueryStatusRequest;
import com.example.datalake.docqa.response.CustomerQueryResponse;
import com.example.datalake.docqa.response.PageResponse;
import com.example.datalake.docqa.service.CustomerQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/customer-queries")
@RequiredArgsConstructor
@Tag(name = "Customer Queries", description = "Unanswered customer questions awaiting a human reply")
public class CustomerQueryController {

    private final CustomerQueryService customerQueryService;

    @Operation(summary = "Capture a question with contact details")
    @PostMapping
    public ResponseEntity<CustomerQueryResponse> capture(@RequestBody CustomerQueryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CustomerQueryResponse.from(
                customerQueryService.capture(request.question(), request.customerName(), request.customerEmail())));
    }

    @Operation(summary = "List captured queries, newest first")
    @GetMapping
    public PageResponse<CustomerQueryResponse> list(@RequestParam(required = false) String status,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "20") int size) {
        CustomerQueryStatus filter = status == null || status.isBlank() ? null : CustomerQueryStatus.fromCode(status);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return PageResponse.from(customerQueryService.list(filter, pageable), CustomerQueryResponse::from);
    }

    @Operation(summary = "Get a captured query")
    @GetMapping("/{id}")
    public CustomerQueryResponse get(@PathVariable UUID id) {
        return CustomerQueryResponse.from(customerQueryService.get(id));
    }

    @Operation(summary = "Move a query to pending, responded or archived")
    @PatchMapping("/{id}/status")
    public CustomerQueryResponse updateStatus(@PathVariable UUID id,
                                              @Valid @RequestBody CustomerQueryStatusRequest request) {
        return CustomerQueryResponse.from(
                customerQueryService.updateStatus(id, CustomerQueryStatus.fromCode(request.status())));
    }
}
