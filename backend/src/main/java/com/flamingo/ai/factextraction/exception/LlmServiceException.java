package com.flamingo.ai.factextraction.exception;

/**
 * Exception thrown when the LLM provider fails. Fatal for the content item being extracted: it is
 * never retried or swallowed by the pipeline.
 */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
