package com.flamingo.ai.semanticquery.extract;

import com.flamingo.ai.semanticquery.scan.StructureNode;

/**
 * Outcome of trying one structure against a target type.
 *
 * @param <T> the target type
 */
public interface ExtractedItem<T> {

  /** The structure this outcome refers to. */
  StructureNode node();

  /** A structure that deserialized as the target type. */
  record Parsed<T>(T value, StructureNode node) implements ExtractedItem<T> {}

  /** A closed structure that neither matched nor had any matching descendant. */
  record Unknown<T>(StructureNode node) implements ExtractedItem<T> {}
}
