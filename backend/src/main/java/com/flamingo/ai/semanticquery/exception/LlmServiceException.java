package com.flamingo.ai.semanticquery.exception;

/** Exception thrown when the language model call behind a structured query fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean streaming;

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean streaming) {
    super(message, cause);
    this.streaming = streaming;
  }

  /** Whether the failure happened after streaming had started. */
  public boolean isStreaming() {
    return streaming;
  }
}
