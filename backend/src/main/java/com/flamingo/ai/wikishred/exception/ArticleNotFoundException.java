package com.flamingo.ai.wikishred.exception;

/** Exception thrown when the archive has no article with the requested ID. */
public class ArticleNotFoundException extends RuntimeException {

  private final String articleId;

  public ArticleNotFoundException(String articleId) {
    super("Article not found: " + articleId);
    this.articleId = articleId;
  }

  public String getArticleId() {
    return articleId;
  }
}
