package com.flamingo.ai.semanticquery.exception;

/** Exception thrown when a response contains no structure matching the requested type. */
public class NoMatchingDataException extends RuntimeException {

  private final String targetType;
  private final String responseText;

  public NoMatchingDataException(String targetType, String responseText) {
    super("No JSON structure matching " + targetType + " found in response");
    this.targetType = targetType;
    this.responseText = responseText;
  }

  public String getTargetType() {
    return targetType;
  }

  /** The response text that was searched, kept for error reporting. */
  public String getResponseText() {
    return responseText;
  }
}
