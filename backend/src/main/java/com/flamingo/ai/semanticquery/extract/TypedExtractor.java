package com.flamingo.ai.semanticquery.extract;

import com.flamingo.ai.semanticquery.scan.JsonStructureScanner;
import com.flamingo.ai.semanticquery.scan.StructureNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides which scanned structures deserialize as a target type.
 *
 * <p>Extraction is parent-first: the full span of a node is tried before any of its children. A
 * match stops the descent, so a nested object that happens to share the target's shape is never
 * reported twice. When the node does not match, each child is tried with the same rule. A node for
 * which neither it nor any descendant matched is reported as {@link ExtractedItem.Unknown}, so no
 * structure disappears from the output.
 *
 * @param <T> the target type
 */
@Slf4j
public class TypedExtractor<T> {

  private final JsonTarget<T> target;

  public TypedExtractor(JsonTarget<T> target) {
    this.target = target;
  }

  /**
   * Extracts from one node.
   *
   * @param text the text the node's coordinates refer to
   * @param node the structure to try
   * @return one {@code Parsed} for the node itself, or the results of its children, or one {@code
   *     Unknown}
   */
  public List<ExtractedItem<T>> extract(String text, StructureNode node) {
    List<ExtractedItem<T>> items = new ArrayList<>();
    extractInto(text, node, items);
    return items;
  }

  private void extractInto(String text, StructureNode node, List<ExtractedItem<T>> items) {
    Optional<T> parsed = target.read(node.slice(text));
    if (parsed.isPresent()) {
      items.add(new ExtractedItem.Parsed<>(parsed.get(), node));
      return;
    }

    int before = items.size();
    for (StructureNode child : node.children()) {
      extractInto(text, child, items);
    }
    if (items.size() == before) {
      items.add(new ExtractedItem.Unknown<>(node));
    }
  }

  /**
   * Scans the whole text and extracts from every root structure.
   *
   * @param text complete text
   * @return the concatenated results, in text order
   */
  public List<ExtractedItem<T>> extractAll(String text) {
    List<ExtractedItem<T>> items = new ArrayList<>();
    for (StructureNode root : JsonStructureScanner.findStructures(text)) {
      extractInto(text, root, items);
    }
    log.debug(
        "Extracted {} item(s) of {} from {} chars",
        items.size(),
        target.typeName(),
        text.length());
    return items;
  }

  /**
   * Collects every instance of the target type found in the text.
   *
   * <p>The whole text is first tried as a list of the target. Otherwise each root is tried as a
   * list, then as a single value, and only then are its children examined. This lets a top-level
   * array of the target short-circuit while still finding single instances scattered through
   * prose.
   *
   * @param text complete text
   * @return all instances, in text order
   */
  public List<T> extractInstances(String text) {
    Optional<List<T>> whole = target.readList(text.trim());
    if (whole.isPresent()) {
      return whole.get();
    }

    List<T> values = new ArrayList<>();
    for (StructureNode root : JsonStructureScanner.findStructures(text)) {
      collectInto(text, root, values);
    }
    return values;
  }

  private void collectInto(String text, StructureNode node, List<T> values) {
    String slice = node.slice(text);
    Optional<List<T>> list = target.readList(slice);
    if (list.isPresent()) {
      values.addAll(list.get());
      return;
    }
    Optional<T> single = target.read(slice);
    if (single.isPresent()) {
      values.add(single.get());
      return;
    }
    for (StructureNode child : node.children()) {
      collectInto(text, child, values);
    }
  }

  /**
   * Returns the first value of the target type in text order, if any.
   *
   * @param text complete text
   * @return the first parsed value
   */
  public Optional<T> extractFirst(String text) {
    for (ExtractedItem<T> item : extractAll(text)) {
      if (item instanceof ExtractedItem.Parsed<T> parsed) {
        return Optional.of(parsed.value());
      }
    }
    return Optional.empty();
  }
}
