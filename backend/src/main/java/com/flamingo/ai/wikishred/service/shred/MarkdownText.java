package com.flamingo.ai.wikishred.service.shred;

import java.util.regex.Pattern;

/** Escaping and final clean-up of generated Markdown. */
final class MarkdownText {

  private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-+*]|\\d+\\.)\\s.*");
  private static final Pattern MULTI_SPACE = Pattern.compile("[ \\t]{2,}");

  private MarkdownText() {}

  /**
   * Escapes Markdown punctuation in literal text.
   *
   * <p>Besides keeping the text literal, this guarantees that article prose can never be mistaken
   * for a placeholder or a header.
   */
  static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      switch (ch) {
        case '\\', '*', '_', '[', ']', '<', '>', '`', '#', '|' -> sb.append('\\').append(ch);
        default -> sb.append(ch);
      }
    }
    return sb.toString();
  }

  /** Collapses line breaks and blank runs into single spaces, for single-line contexts. */
  static String singleLine(String markdown) {
    return markdown.replaceAll("\\s*\\n\\s*", " ").strip();
  }

  /**
   * Normalizes generated Markdown.
   *
   * <p>Outside fenced code: trailing whitespace is removed, leading whitespace is removed except in
   * front of list markers, repeated spaces collapse, and runs of blank lines collapse to one.
   * Leading and trailing blank lines are dropped; non-empty output ends with one newline.
   */
  static String normalize(String markdown) {
    String[] lines = markdown.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
    StringBuilder sb = new StringBuilder(markdown.length());
    boolean inFence = false;
    boolean pendingBlank = false;
    for (String line : lines) {
      if (line.strip().startsWith("```")) {
        inFence = !inFence;
        pendingBlank = appendLine(sb, line.strip(), pendingBlank);
        continue;
      }
      if (inFence) {
        sb.append(line.stripTrailing()).append('\n');
        continue;
      }
      String cleaned;
      if (LIST_MARKER.matcher(line).matches()) {
        String indent = line.substring(0, line.length() - line.stripLeading().length());
        cleaned = indent + MULTI_SPACE.matcher(line.strip()).replaceAll(" ");
      } else {
        cleaned = MULTI_SPACE.matcher(line.strip()).replaceAll(" ");
      }
      if (cleaned.isEmpty()) {
        pendingBlank = sb.length() > 0;
        continue;
      }
      pendingBlank = appendLine(sb, cleaned, pendingBlank);
    }
    return sb.toString();
  }

  private static boolean appendLine(StringBuilder sb, String line, boolean pendingBlank) {
    if (pendingBlank) {
      sb.append('\n');
    }
    sb.append(line).append('\n');
    return false;
  }
}
