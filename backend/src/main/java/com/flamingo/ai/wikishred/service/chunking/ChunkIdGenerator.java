package com.flamingo.ai.wikishred.service.chunking;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/** Derives chunk IDs from their position in the article's section structure. */
public final class ChunkIdGenerator {

  private static final char SEPARATOR = '\u001f';

  private ChunkIdGenerator() {}

  /**
   * Name-based (type 3) UUID over article ID, section path keys and sequence index. Re-ingesting
   * an unchanged article therefore reproduces the same IDs.
   *
   * @param articleId article ID
   * @param sectionKeys disambiguated section path keys
   * @param sequenceIndex index within a split section
   */
  public static String generate(String articleId, List<String> sectionKeys, int sequenceIndex) {
    StringBuilder name = new StringBuilder(articleId);
    for (String key : sectionKeys) {
      name.append(SEPARATOR).append(key);
    }
    name.append(SEPARATOR).append(sequenceIndex);
    return UUID.nameUUIDFromBytes(name.toString().getBytes(StandardCharsets.UTF_8)).toString();
  }
}
