package com.flamingo.ai.wikishred.service.ingest;

import java.util.List;

/**
 * Aggregate outcome of a batch ingestion.
 *
 * @param total articles attempted
 * @param ingested articles stored
 * @param failed articles that failed
 * @param chunkCount chunks stored across the batch
 * @param warningCount shredding warnings across the batch
 * @param elapsedMillis wall-clock duration
 * @param results per-article results in submission order
 */
public record BatchReport(
    int total,
    int ingested,
    int failed,
    long chunkCount,
    long warningCount,
    long elapsedMillis,
    List<IngestionResult> results) {

  public BatchReport {
    results = List.copyOf(results);
  }

  public static BatchReport of(List<IngestionResult> results, long elapsedMillis) {
    int ingested = (int) results.stream().filter(IngestionResult::succeeded).count();
    long chunks = results.stream().mapToLong(IngestionResult::chunkCount).sum();
    long warnings = results.stream().mapToLong(result -> result.warnings().size()).sum();
    return new BatchReport(
        results.size(),
        ingested,
        results.size() - ingested,
        chunks,
        warnings,
        elapsedMillis,
        results);
  }
}
