package com.flamingo.ai.wikishred.service.shred.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Output of one shredding pass over an article. Immutable.
 *
 * <p>Every token placeholder in {@code markdown} has exactly one entry in {@code sidecar} and vice
 * versa.
 *
 * @param articleId archive article ID
 * @param title article title
 * @param markdown Markdown body with embedded placeholders
 * @param sidecar extracted heavy elements in document order
 * @param images image references in document order
 * @param abstractText Markdown preceding the first header (capped)
 * @param toc headings of level 2 and 3
 * @param warnings recoverable problems met while shredding
 */
public record ShreddedDocument(
    String articleId,
    String title,
    String markdown,
    List<SidecarEntry> sidecar,
    List<ImageReference> images,
    String abstractText,
    List<TocEntry> toc,
    List<ShredWarning> warnings) {

  public ShreddedDocument {
    sidecar = List.copyOf(sidecar);
    images = List.copyOf(images);
    toc = List.copyOf(toc);
    warnings = List.copyOf(warnings);
  }

  /** Token IDs of all sidecar entries, in document order. */
  public Set<String> tokenIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (SidecarEntry entry : sidecar) {
      ids.add(entry.tokenId());
    }
    return ids;
  }

  public Optional<SidecarEntry> sidecarEntry(String tokenId) {
    return sidecar.stream().filter(entry -> entry.tokenId().equals(tokenId)).findFirst();
  }
}
