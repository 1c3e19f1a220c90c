package com.flamingo.ai.wikishred.service.ingest;

/** Outcome of ingesting one article. */
public enum IngestionStatus {
  INGESTED,
  FAILED
}
