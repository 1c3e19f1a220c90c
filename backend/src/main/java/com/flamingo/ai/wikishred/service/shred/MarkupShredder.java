package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.archive.Article;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;

/**
 * Converts raw article markup into Markdown plus a sidecar of extracted structured elements.
 *
 * <p>Implementations must be stateless and deterministic: the same article always yields a
 * byte-identical document, whichever thread runs it and however often.
 */
public interface MarkupShredder {

  /**
   * Shreds one article. Malformed markup is recovered and reported through {@link
   * ShreddedDocument#warnings()}; it never aborts the article.
   *
   * @param article article to shred
   * @return the shredded document
   */
  ShreddedDocument shred(Article article);
}
