package com.example.datalake.docqa.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Mutable trail of one ingestion run; returned to the caller once the run settles. */
@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class IngestionReport {
  private UUID documentId;
  private DocumentStatus status;
  private int chunksCreated;
  private int embeddingsCreated;
  private String errorMessage;
  private List<StepLog> steps = new ArrayList<>();

  public IngestionReport(UUID documentId) {
    this.documentId = documentId;
  }

  public IngestionReport addStep(String name, String note) {
    steps.add(new StepLog().setName(name).setNote(note).setAt(Instant.now()));
    return this;
  }
}
