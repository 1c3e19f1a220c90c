package com.flamingo.ai.wikishred.exception;

/**
 * Exception thrown when chunk size thresholds are inconsistent.
 *
 * <p>Raised while the chunker is being configured, so the application refuses to start rather than
 * producing chunks under a broken policy.
 */
public class InvalidChunkingConfigException extends RuntimeException {

  public InvalidChunkingConfigException(String message) {
    super(message);
  }
}
