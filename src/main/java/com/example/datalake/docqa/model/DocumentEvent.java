package com.example.datalake.docqa.model;

/** Inputs of the document status machine, see {@link DocumentStatus#next(DocumentEvent)}. */
public enum DocumentEvent {
  /** All chunks of the document were persisted. */
  CHUNKS_STORED,
  /** Every chunk of the document has an embedding. */
  EMBEDDINGS_STORED,
  /** Any stage failed. */
  FAILURE,
  /** A failed document is picked up again. */
  RETRY
}
