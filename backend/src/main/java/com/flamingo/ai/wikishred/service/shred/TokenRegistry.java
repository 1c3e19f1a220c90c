package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.exception.TokenIntegrityException;
import com.flamingo.ai.wikishred.service.shred.model.SidecarCategory;
import com.flamingo.ai.wikishred.service.shred.model.SidecarEntry;
import com.flamingo.ai.wikishred.service.shred.model.SidecarPayload;
import com.flamingo.ai.wikishred.service.token.PlaceholderToken;
import com.flamingo.ai.wikishred.service.token.TokenScanner;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Issues placeholder tokens for one article.
 *
 * <p>Token IDs are the category prefix plus a per-category ordinal counted in the order elements
 * are registered ({@code TBL_1}, {@code TBL_2}, {@code INFO_1} and so on). A registry belongs to a
 * single shredding pass and is never shared between articles or threads.
 */
public final class TokenRegistry {

  private final String articleId;
  private final int maxLabelLength;
  private final Map<SidecarCategory, Integer> ordinals = new EnumMap<>(SidecarCategory.class);
  private final Map<String, SidecarEntry> entries = new LinkedHashMap<>();

  public TokenRegistry(String articleId, int maxLabelLength) {
    this.articleId = articleId;
    this.maxLabelLength = maxLabelLength;
  }

  /**
   * Registers an extracted element and returns the placeholder to put in its place.
   *
   * @param category element kind
   * @param label candidate label; sanitized, falls back to a category default
   * @param anchor structural path of the element
   * @param payload extracted content
   * @param warnings degradation reasons; non-empty marks the entry as degraded
   * @return placeholder carrying the new token ID
   */
  public PlaceholderToken register(
      SidecarCategory category,
      String label,
      String anchor,
      SidecarPayload payload,
      List<String> warnings) {
    int ordinal = ordinals.merge(category, 1, Integer::sum);
    String tokenId = category.tokenPrefix() + "_" + ordinal;
    String safeLabel =
        PlaceholderToken.sanitizeLabel(label, defaultLabel(category), maxLabelLength);
    PlaceholderToken token = new PlaceholderToken(category, tokenId, safeLabel);
    entries.put(
        tokenId,
        new SidecarEntry(
            tokenId, category, safeLabel, anchor, payload, !warnings.isEmpty(), warnings));
    return token;
  }

  public List<SidecarEntry> entries() {
    return new ArrayList<>(entries.values());
  }

  public int size() {
    return entries.size();
  }

  /**
   * Checks that {@code markdown} holds exactly one placeholder per registered entry and nothing
   * else.
   *
   * @throws TokenIntegrityException if the token set and the sidecar keys differ
   */
  public void verify(String markdown) {
    Map<String, Integer> occurrences = new HashMap<>();
    Set<String> unknown = new LinkedHashSet<>();
    for (TokenScanner.TokenMatch match : TokenScanner.scan(markdown)) {
      PlaceholderToken token = match.token();
      SidecarEntry entry = entries.get(token.tokenId());
      if (entry == null || entry.category() != token.category()) {
        unknown.add(token.tokenId());
        continue;
      }
      if (occurrences.merge(token.tokenId(), 1, Integer::sum) > 1) {
        unknown.add(token.tokenId());
      }
    }
    Set<String> missing = new LinkedHashSet<>(entries.keySet());
    missing.removeAll(occurrences.keySet());
    if (!missing.isEmpty() || !unknown.isEmpty()) {
      throw new TokenIntegrityException(
          "Token/sidecar mismatch in article " + articleId, missing, unknown);
    }
  }

  private static String defaultLabel(SidecarCategory category) {
    return switch (category) {
      case TABLE -> "Data Table";
      case INFOBOX -> "Summary of Attributes";
      case FORMULA -> "Formula";
    };
  }
}
