package com.flamingo.ai.wikishred.exception;

/** Exception thrown when a processed article cannot be persisted. */
public class ArticleStorageException extends RuntimeException {

  private final String articleId;
  private final String userMessage;

  public ArticleStorageException(String articleId, String message, Throwable cause) {
    super(message, cause);
    this.articleId = articleId;
    this.userMessage = "Article storage is temporarily unavailable. Please try again.";
  }

  public String getArticleId() {
    return articleId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
