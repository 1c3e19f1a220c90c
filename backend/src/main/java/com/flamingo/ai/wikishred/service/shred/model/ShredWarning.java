package com.flamingo.ai.wikishred.service.shred.model;

/**
 * Non-fatal problem met while shredding an article.
 *
 * @param kind problem class
 * @param location where it happened (structural path, source offset or token ID)
 * @param message description
 */
public record ShredWarning(Kind kind, String location, String message) {

  /** Problem classes. */
  public enum Kind {
    /** Malformed markup that was recovered as flow text. */
    PARSE_RECOVERABLE,
    /** Heavy element whose internal structure was not recognized. */
    EXTRACTION_DEGRADED
  }

  @Override
  public String toString() {
    return kind + " at " + location + ": " + message;
  }
}
