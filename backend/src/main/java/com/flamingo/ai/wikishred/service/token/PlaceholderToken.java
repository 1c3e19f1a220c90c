package com.flamingo.ai.wikishred.service.token;

import com.flamingo.ai.wikishred.service.shred.model.SidecarCategory;
import java.util.regex.Pattern;

/**
 * Inline placeholder marking where a sidecar element was lifted out of the Markdown.
 *
 * <p>Textual form: {@code **[<<CATEGORY: TOKEN_ID | ShortLabel>>]**}, e.g. {@code **[<<TABLE:
 * TBL_1 | GDP Data>>]**}. Labels never contain {@code | < > [ ] *} or line breaks, which keeps the
 * form unambiguous for {@link TokenScanner}.
 *
 * @param category element kind
 * @param tokenId per-article token ID
 * @param label short human label
 */
public record PlaceholderToken(SidecarCategory category, String tokenId, String label) {

  /** Matches one rendered placeholder; groups: marker, token ID, label. */
  static final Pattern PATTERN =
      Pattern.compile(
          "\\*\\*\\[<<(TABLE|INFOBOX|FORMULA): ((?:TBL|INFO|MATH)_[0-9]+)"
              + " \\| ([^|<>\\[\\]*\\r\\n]+)>>]\\*\\*");

  private static final Pattern FORBIDDEN_LABEL_CHARS = Pattern.compile("[|<>\\[\\]*\\r\\n]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public PlaceholderToken {
    if (FORBIDDEN_LABEL_CHARS.matcher(label).find() || label.isBlank()) {
      throw new IllegalArgumentException("Label not usable inside a placeholder: '" + label + "'");
    }
  }

  /** Renders the exact placeholder text. */
  public String render() {
    return "**[<<" + category.marker() + ": " + tokenId + " | " + label + ">>]**";
  }

  /**
   * Makes arbitrary text usable as a placeholder label.
   *
   * @param raw candidate label, may be {@code null}
   * @param fallback label used when nothing printable remains
   * @param maxLength maximum label length
   * @return sanitized, non-blank label
   */
  public static String sanitizeLabel(String raw, String fallback, int maxLength) {
    String cleaned = raw == null ? "" : FORBIDDEN_LABEL_CHARS.matcher(raw).replaceAll(" ");
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    if (cleaned.length() > maxLength) {
      cleaned = cleaned.substring(0, maxLength).strip();
    }
    return cleaned.isEmpty() ? fallback : cleaned;
  }

  @Override
  public String toString() {
    return render();
  }
}
