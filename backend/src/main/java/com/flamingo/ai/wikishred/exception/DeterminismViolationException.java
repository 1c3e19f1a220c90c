package com.flamingo.ai.wikishred.exception;

/**
 * Exception thrown when processing the same article twice produced different output.
 *
 * <p>This is a defect in the pipeline, never an expected runtime condition.
 */
public class DeterminismViolationException extends RuntimeException {

  private final String articleId;

  public DeterminismViolationException(String articleId, String message) {
    super("Non-deterministic output for article " + articleId + ": " + message);
    this.articleId = articleId;
  }

  public String getArticleId() {
    return articleId;
  }
}
