package com.flamingo.ai.wikishred.exception;

/** Exception thrown when an article cannot be read, shredded or chunked. */
public class ArticleProcessingException extends RuntimeException {

  private final String articleId;
  private final String userMessage;

  public ArticleProcessingException(String articleId, String message) {
    super(message);
    this.articleId = articleId;
    this.userMessage = "Failed to process article";
  }

  public ArticleProcessingException(String articleId, String message, Throwable cause) {
    super(message, cause);
    this.articleId = articleId;
    this.userMessage = "Failed to process article";
  }

  public String getArticleId() {
    return articleId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
