package com.flamingo.ai.wikishred.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ArticleNotFoundException.class)
  public ResponseEntity<ApiError> handleArticleNotFound(
      ArticleNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("article_not_found");
    String errorId = generateErrorId();
    log.warn("Article not found [{}]: {}", errorId, ex.getArticleId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.ARTICLE_NOT_FOUND, "Article not found", request);
  }

  @ExceptionHandler(ArticleProcessingException.class)
  public ResponseEntity<ApiError> handleArticleProcessing(
      ArticleProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("article_processing");
    String errorId = generateErrorId();
    log.error("Article processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.ARTICLE_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ArticleStorageException.class)
  public ResponseEntity<ApiError> handleStorage(
      ArticleStorageException ex, HttpServletRequest request) {

    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error(
        "Storage error [{}] for article {}: {}",
        errorId,
        ex.getArticleId(),
        ex.getMessage(),
        ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORAGE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler({TokenIntegrityException.class, DeterminismViolationException.class})
  public ResponseEntity<ApiError> handlePipelineDefect(
      RuntimeException ex, HttpServletRequest request) {

    incrementErrorCounter("pipeline_integrity");
    String errorId = generateErrorId();
    log.error("Pipeline integrity violation [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.PIPELINE_INTEGRITY_ERROR,
        "Article output failed an integrity check",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
