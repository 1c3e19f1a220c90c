package com.flamingo.ai.wikishred.service.shred.model;

import java.util.List;

/**
 * A heavy element lifted out of an article's flow text.
 *
 * <p>The Markdown body of the owning {@link ShreddedDocument} contains exactly one placeholder
 * carrying {@code tokenId}.
 *
 * @param tokenId per-article token, e.g. {@code TBL_1}
 * @param category element kind
 * @param label short human label shown inside the placeholder
 * @param anchor structural path of the element in the markup tree, e.g. {@code
 *     body/div[0]/table[2]}
 * @param payload structured content
 * @param degraded {@code true} when extraction fell back to a best-effort rendering
 * @param warnings human-readable reasons for degradation
 */
public record SidecarEntry(
    String tokenId,
    SidecarCategory category,
    String label,
    String anchor,
    SidecarPayload payload,
    boolean degraded,
    List<String> warnings) {

  public SidecarEntry {
    warnings = List.copyOf(warnings);
  }
}
