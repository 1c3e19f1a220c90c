package com.flamingo.ai.wikishred.service.chunking;

import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.exception.InvalidChunkingConfigException;

/**
 * Validated chunk size policy, in characters.
 *
 * @param minChunkSize pieces below this merge with their neighbours
 * @param targetChunkSize size a split window grows to
 * @param maxChunkSize hard upper bound, except for an oversized single token
 * @param overlapSize trailing characters repeated at the start of the next split chunk
 */
public record ChunkingPolicy(
    int minChunkSize, int targetChunkSize, int maxChunkSize, int overlapSize) {

  public ChunkingPolicy {
    if (minChunkSize <= 0 || targetChunkSize <= 0 || maxChunkSize <= 0) {
      throw new InvalidChunkingConfigException(
          String.format(
              "Chunk sizes must be positive (min=%d, target=%d, max=%d)",
              minChunkSize, targetChunkSize, maxChunkSize));
    }
    if (overlapSize < 0) {
      throw new InvalidChunkingConfigException("Overlap size must not be negative: " + overlapSize);
    }
    if (targetChunkSize > maxChunkSize) {
      throw new InvalidChunkingConfigException(
          String.format(
              "Target chunk size %d exceeds max chunk size %d", targetChunkSize, maxChunkSize));
    }
    if (minChunkSize > targetChunkSize) {
      throw new InvalidChunkingConfigException(
          String.format(
              "Min chunk size %d exceeds target chunk size %d", minChunkSize, targetChunkSize));
    }
    if (overlapSize >= targetChunkSize) {
      throw new InvalidChunkingConfigException(
          String.format(
              "Overlap size %d must be smaller than target chunk size %d",
              overlapSize, targetChunkSize));
    }
  }

  public static ChunkingPolicy from(WikiConfig.Chunking chunking) {
    return new ChunkingPolicy(
        chunking.getMinChunkSize(),
        chunking.getTargetChunkSize(),
        chunking.getMaxChunkSize(),
        chunking.getOverlapSize());
  }
}
