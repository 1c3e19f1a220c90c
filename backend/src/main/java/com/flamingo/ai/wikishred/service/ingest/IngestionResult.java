package com.flamingo.ai.wikishred.service.ingest;

import java.util.List;

/**
 * Per-article ingestion outcome.
 *
 * @param articleId article ID
 * @param status outcome
 * @param chunkCount chunks stored, 0 on failure
 * @param sidecarCount sidecar entries stored, 0 on failure
 * @param warnings shredding warnings, rendered as text
 * @param error failure message, {@code null} on success
 */
public record IngestionResult(
    String articleId,
    IngestionStatus status,
    int chunkCount,
    int sidecarCount,
    List<String> warnings,
    String error) {

  public IngestionResult {
    warnings = List.copyOf(warnings);
  }

  public static IngestionResult ingested(
      String articleId, int chunkCount, int sidecarCount, List<String> warnings) {
    return new IngestionResult(
        articleId, IngestionStatus.INGESTED, chunkCount, sidecarCount, warnings, null);
  }

  public static IngestionResult failed(String articleId, String error) {
    return new IngestionResult(articleId, IngestionStatus.FAILED, 0, 0, List.of(), error);
  }

  public boolean succeeded() {
    return status == IngestionStatus.INGESTED;
  }
}
