package com.flamingo.ai.semanticquery.exception;

/** Exception thrown when streamed bytes are not valid text in the expected encoding. */
public class StreamDecodingException extends RuntimeException {

  private final long byteOffset;

  public StreamDecodingException(long byteOffset, String message) {
    super(message);
    this.byteOffset = byteOffset;
  }

  /** Stream offset of the first byte that could not be decoded. */
  public long getByteOffset() {
    return byteOffset;
  }
}
