package com.flamingo.ai.wikishred.service.shred;

import java.util.Locale;

/**
 * Normalizes link targets found in article markup.
 *
 * <p>Internal targets lose relative prefixes ({@code ./}, {@code ../}), the {@code /wiki/} path and
 * the {@code A/} article namespace, and use underscores instead of spaces, so {@code
 * ../A/Apollo 11#Launch} becomes {@code Apollo_11#Launch}. External and fragment-only targets are
 * kept as they are.
 */
final class LinkNormalizer {

  private static final String[] INTERNAL_PREFIXES = {"./", "../", "/wiki/", "A/", "/"};

  private LinkNormalizer() {}

  /**
   * Returns the normalized target, or an empty string when the link should be dropped.
   *
   * @param href raw {@code href} attribute
   */
  static String normalize(String href) {
    if (href == null) {
      return "";
    }
    String target = href.strip();
    if (target.isEmpty()) {
      return "";
    }
    String lower = target.toLowerCase(Locale.ROOT);
    if (lower.startsWith("javascript:")) {
      return "";
    }
    if (isExternal(lower) || target.startsWith("#")) {
      return encodeUnsafe(target.replace(" ", "%20"));
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (String prefix : INTERNAL_PREFIXES) {
        if (target.startsWith(prefix)) {
          target = target.substring(prefix.length());
          changed = true;
        }
      }
    }
    return encodeUnsafe(target.replace(' ', '_'));
  }

  static boolean isExternal(String lowerCaseHref) {
    return lowerCaseHref.startsWith("http://")
        || lowerCaseHref.startsWith("https://")
        || lowerCaseHref.startsWith("//")
        || lowerCaseHref.startsWith("mailto:")
        || lowerCaseHref.startsWith("ftp://");
  }

  private static String encodeUnsafe(String target) {
    return target.replace("<", "%3C").replace(">", "%3E");
  }
}
