package com.flamingo.ai.wikishred.service.chunking.model;

import java.util.List;

/**
 * A size-bounded span of article Markdown ready for indexing.
 *
 * @param id deterministic ID derived from article ID, section path and sequence index
 * @param articleId article the chunk belongs to
 * @param sectionPath header titles from the document root to the chunk's section
 * @param sequenceIndex position within the split of one section, 0 when not split
 * @param ordinal position within the article
 * @param content chunk text, starting with {@code overlapLength} characters of repeated context
 * @param overlapLength length of the leading overlap, 0 if none
 * @param tokenRefs IDs of placeholder tokens contained in the chunk body
 * @param type how the chunk was formed
 */
public record Chunk(
    String id,
    String articleId,
    List<String> sectionPath,
    int sequenceIndex,
    int ordinal,
    String content,
    int overlapLength,
    List<String> tokenRefs,
    ChunkType type) {

  public Chunk {
    sectionPath = List.copyOf(sectionPath);
    tokenRefs = List.copyOf(tokenRefs);
  }

  /** Content without the repeated leading overlap. */
  public String body() {
    return content.substring(overlapLength);
  }

  public int length() {
    return content.length();
  }
}
