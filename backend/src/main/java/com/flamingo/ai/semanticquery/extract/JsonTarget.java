package com.flamingo.ai.semanticquery.extract;

import java.util.List;
import java.util.Optional;

/**
 * Target type that a JSON span can be tried against.
 *
 * <p>Both methods report a mismatch as an empty result rather than an exception: a structure that
 * does not fit the target is an expected outcome during extraction, not an error.
 *
 * @param <T> the type produced on success
 */
public interface JsonTarget<T> {

  /**
   * Attempts to read {@code json} as a single {@code T}.
   *
   * @param json a JSON-shaped text span
   * @return the value, or empty when the span does not deserialize as {@code T}
   */
  Optional<T> read(String json);

  /**
   * Attempts to read {@code json} as a sequence of {@code T}.
   *
   * @param json a JSON-shaped text span
   * @return the values, or empty when the span is not an array of {@code T}
   */
  Optional<List<T>> readList(String json);

  /** Human-readable name of the target type, used in logs and metrics. */
  String typeName();
}
