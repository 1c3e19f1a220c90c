package com.flamingo.ai.wikishred.archive;

import java.util.List;
import java.util.Optional;

/**
 * Random-access view of a wiki archive.
 *
 * <p>Implementations must support concurrent reads: the ingestion pool looks up many articles at
 * the same time and never writes.
 */
public interface ArchiveReader {

  /**
   * Looks up one article.
   *
   * @param articleId archive article ID
   * @return the article, or empty if the archive has no such entry
   */
  Optional<Article> findArticle(String articleId);

  /** IDs of all articles in the archive, in a stable order. */
  List<String> listArticleIds();
}
