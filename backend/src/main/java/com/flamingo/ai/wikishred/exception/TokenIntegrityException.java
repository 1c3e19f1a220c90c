package com.flamingo.ai.wikishred.exception;

import java.util.Set;

/** Thrown when placeholder tokens in Markdown and sidecar keys do not match one to one. */
public class TokenIntegrityException extends RuntimeException {

  private final Set<String> missingFromMarkdown;
  private final Set<String> unknownInMarkdown;

  public TokenIntegrityException(
      String message, Set<String> missingFromMarkdown, Set<String> unknownInMarkdown) {
    super(
        message
            + " (missing from markdown: "
            + missingFromMarkdown
            + ", unknown or repeated in markdown: "
            + unknownInMarkdown
            + ")");
    this.missingFromMarkdown = Set.copyOf(missingFromMarkdown);
    this.unknownInMarkdown = Set.copyOf(unknownInMarkdown);
  }

  public Set<String> getMissingFromMarkdown() {
    return missingFromMarkdown;
  }

  public Set<String> getUnknownInMarkdown() {
    return unknownInMarkdown;
  }
}
