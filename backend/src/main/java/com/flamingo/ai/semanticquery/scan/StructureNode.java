package com.flamingo.ai.semanticquery.scan;

import java.util.List;

/**
 * One matched {@code {...}} or {@code [...]} span.
 *
 * <p>{@code start} is the offset of the opening bracket and {@code end} the offset of the matching
 * closing bracket (inclusive). {@code children} holds the structures nested exactly one level
 * inside this one, in the order their opening bracket appears. Nodes are only created once their
 * closing bracket has been seen and never change afterwards.
 */
public record StructureNode(int start, int end, StructureKind kind, List<StructureNode> children) {

  public StructureNode {
    if (start >= end) {
      throw new IllegalArgumentException(
          "Structure must end after it starts: start=" + start + ", end=" + end);
    }
    children = List.copyOf(children);
  }

  /** Number of characters covered by this node, brackets included. */
  public int length() {
    return end - start + 1;
  }

  /** Exclusive end offset, convenient for {@code substring}. */
  public int endExclusive() {
    return end + 1;
  }

  /** Returns the text covered by this node. */
  public String slice(CharSequence text) {
    return text.subSequence(start, end + 1).toString();
  }

  /** Returns a copy of this subtree with every offset moved by {@code delta}. */
  public StructureNode shift(int delta) {
    if (delta == 0) {
      return this;
    }
    List<StructureNode> shifted = children.stream().map(child -> child.shift(delta)).toList();
    return new StructureNode(start + delta, end + delta, kind, shifted);
  }
}
