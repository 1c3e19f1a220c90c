package com.flamingo.ai.wikishred.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String ARTICLE_NOT_FOUND = "ARTICLE_001";
  public static final String ARTICLE_PROCESSING_ERROR = "ARTICLE_002";
  public static final String STORAGE_ERROR = "STORAGE_001";
  public static final String PIPELINE_INTEGRITY_ERROR = "PIPELINE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
