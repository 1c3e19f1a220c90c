package com.flamingo.ai.wikishred.service.chunking;

import com.flamingo.ai.wikishred.service.chunking.model.Chunk;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import java.util.List;

/**
 * Splits article Markdown into an ordered list of {@link Chunk}s.
 *
 * <p>Implementations must be stateless and safe for concurrent use.
 */
public interface DocumentChunker {

  /**
   * Chunks Markdown that may contain placeholder tokens. Tokens are never divided.
   *
   * @param articleId article the Markdown belongs to
   * @param markdown Markdown body
   * @return chunks in document order, empty for a blank body
   */
  List<Chunk> chunk(String articleId, String markdown);

  default List<Chunk> chunk(ShreddedDocument document) {
    return chunk(document.articleId(), document.markdown());
  }
}
