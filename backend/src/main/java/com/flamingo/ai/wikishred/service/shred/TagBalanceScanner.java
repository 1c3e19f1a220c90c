package com.flamingo.ai.wikishred.service.shred;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds start tags in raw markup that are never closed.
 *
 * <p>The HTML parser silently closes such elements, so this scan over the original source is the
 * only way to tell that a table was cut off.
 */
final class TagBalanceScanner {

  private static final Pattern COMMENTS_AND_RAW_TEXT =
      Pattern.compile(
          "<!--.*?-->|<script\\b.*?</script\\s*>|<style\\b.*?</style\\s*>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private TagBalanceScanner() {}

  /**
   * Returns the 0-based ordinals, in source order, of {@code <tagName>} start tags without a
   * matching end tag.
   */
  static Set<Integer> unclosedOrdinals(String rawMarkup, String tagName) {
    String source = COMMENTS_AND_RAW_TEXT.matcher(rawMarkup).replaceAll(" ");
    Pattern tags =
        Pattern.compile(
            "<(/?)" + Pattern.quote(tagName) + "(?=[\\s/>])[^>]*>", Pattern.CASE_INSENSITIVE);
    Deque<Integer> open = new ArrayDeque<>();
    int ordinal = 0;
    Matcher matcher = tags.matcher(source);
    while (matcher.find()) {
      if (matcher.group(1).isEmpty()) {
        open.push(ordinal++);
      } else if (!open.isEmpty()) {
        open.pop();
      }
    }
    return new TreeSet<>(open);
  }
}
