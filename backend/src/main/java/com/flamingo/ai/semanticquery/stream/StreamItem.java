package com.flamingo.ai.semanticquery.stream;

/**
 * One item of the ordered output produced from model text.
 *
 * @param <T> the target type of {@link Data} items
 */
public interface StreamItem<T> {

  /** Text this item stands for in the model output. */
  String asText();

  /** A raw token forwarded as soon as it arrives, for live display. */
  record Token<T>(String text) implements StreamItem<T> {
    @Override
    public String asText() {
      return text;
    }
  }

  /** A finalized span of free text, including JSON that did not match the target type. */
  record Text<T>(String text) implements StreamItem<T> {
    @Override
    public String asText() {
      return text;
    }
  }

  /**
   * A structure that deserialized as the target type.
   *
   * @param value the deserialized value
   * @param source the exact text span it was read from
   */
  record Data<T>(T value, String source) implements StreamItem<T> {
    @Override
    public String asText() {
      return source;
    }
  }

  static <T> StreamItem<T> token(String text) {
    return new Token<>(text);
  }

  static <T> StreamItem<T> text(String text) {
    return new Text<>(text);
  }

  static <T> StreamItem<T> data(T value, String source) {
    return new Data<>(value, source);
  }
}
