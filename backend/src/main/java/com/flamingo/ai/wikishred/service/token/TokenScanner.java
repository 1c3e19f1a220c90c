package com.flamingo.ai.wikishred.service.token;

import com.flamingo.ai.wikishred.service.shred.model.SidecarCategory;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/** Finds rendered {@link PlaceholderToken}s in Markdown text. */
public final class TokenScanner {

  private TokenScanner() {}

  /**
   * A placeholder occurrence.
   *
   * @param token the parsed placeholder
   * @param start offset of the first character
   * @param end offset after the last character
   */
  public record TokenMatch(PlaceholderToken token, int start, int end) {

    public int length() {
      return end - start;
    }
  }

  /** Returns every placeholder in {@code text}, in order of appearance. */
  public static List<TokenMatch> scan(String text) {
    List<TokenMatch> matches = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return matches;
    }
    Matcher matcher = PlaceholderToken.PATTERN.matcher(text);
    while (matcher.find()) {
      PlaceholderToken token =
          new PlaceholderToken(
              SidecarCategory.fromMarker(matcher.group(1)),
              matcher.group(2),
              matcher.group(3).strip());
      matches.add(new TokenMatch(token, matcher.start(), matcher.end()));
    }
    return matches;
  }

  /** Distinct token IDs found in {@code text}, in order of first appearance. */
  public static Set<String> tokenIds(String text) {
    Set<String> ids = new LinkedHashSet<>();
    for (TokenMatch match : scan(text)) {
      ids.add(match.token().tokenId());
    }
    return ids;
  }

  public static boolean containsToken(String text) {
    return text != null && PlaceholderToken.PATTERN.matcher(text).find();
  }
}
