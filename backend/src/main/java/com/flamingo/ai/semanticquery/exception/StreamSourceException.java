package com.flamingo.ai.semanticquery.exception;

/** Exception thrown when the upstream byte or line source fails while being read. */
public class StreamSourceException extends RuntimeException {

  public StreamSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
