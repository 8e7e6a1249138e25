package com.example.datalake.docqa.model;

import com.example.datalake.docqa.exception.InvalidStatusTransitionException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ingestion state of a document.
 *
 * <pre>
 * processing --CHUNKS_STORED--> chunks_created --EMBEDDINGS_STORED--> completed
 *      any   --FAILURE--------> failed
 *   failed   --RETRY----------> processing
 * </pre>
 */
public enum DocumentStatus {
  PROCESSING("processing"),
  CHUNKS_CREATED("chunks_created"),
  COMPLETED("completed"),
  FAILED("failed");

  private static final Map<DocumentStatus, Map<DocumentEvent, DocumentStatus>> TRANSITIONS = buildTransitions();

  private final String code;

  DocumentStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canApply(DocumentEvent event) {
    return TRANSITIONS.get(this).containsKey(event);
  }

  public DocumentStatus next(DocumentEvent event) {
    DocumentStatus target = TRANSITIONS.get(this).get(event);
    if (target == null) {
      throw new InvalidStatusTransitionException(this, event);
    }
    return target;
  }

  public static DocumentStatus fromCode(String code) {
    if (code == null) {
      return null;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(s -> s.code.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown document status: " + code));
  }

  private static Map<DocumentStatus, Map<DocumentEvent, DocumentStatus>> buildTransitions() {
    Map<DocumentStatus, Map<DocumentEvent, DocumentStatus>> table = new EnumMap<>(DocumentStatus.class);
    for (DocumentStatus status : values()) {
      Map<DocumentEvent, DocumentStatus> row = new EnumMap<>(DocumentEvent.class);
      row.put(DocumentEvent.FAILURE, FAILED);
      table.put(status, row);
    }
    table.get(PROCESSING).put(DocumentEvent.CHUNKS_STORED, CHUNKS_CREATED);
    table.get(CHUNKS_CREATED).put(DocumentEvent.EMBEDDINGS_STORED, COMPLETED);
    table.get(FAILED).put(DocumentEvent.RETRY, PROCESSING);
    table.replaceAll((k, v) -> Collections.unmodifiableMap(v));
    return Collections.unmodifiableMap(table);
  }
}
