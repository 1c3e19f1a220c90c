package com.flamingo.ai.wikishred.storage;

import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import java.util.List;

/**
 * Persists processed articles.
 *
 * <p>An article's document and its full chunk set form one unit: a save either replaces the
 * previous version completely or leaves it untouched.
 */
public interface ArticleStore {

  /**
   * Stores a shredded document with its chunks, replacing any earlier version.
   *
   * @throws com.flamingo.ai.wikishred.exception.ArticleStorageException if the write fails
   */
  void save(ShreddedDocument document, List<Chunk> chunks);
}
