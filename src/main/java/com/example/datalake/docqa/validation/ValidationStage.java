package com.example.datalake.docqa.validation;

/** Identifies where in question answering a validator runs. */
public enum ValidationStage {
  /** Shape checks on the raw question, before anything is embedded. */
  PRE_EMBEDDING,
  /** Limits applied to the cleaned question before retrieval. */
  PRE_RETRIEVAL
}
