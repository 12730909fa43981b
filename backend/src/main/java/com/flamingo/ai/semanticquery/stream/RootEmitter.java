package com.flamingo.ai.semanticquery.stream;

import com.flamingo.ai.semanticquery.extract.ExtractedItem;
import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.scan.StructureNode;
import java.util.List;

/** Turns one closed root structure and the text around it into stream items. */
final class RootEmitter {

  private RootEmitter() {}

  /** Adds {@code text[from, to)} as a text item unless it is empty or only whitespace. */
  static <T> void emitGap(String text, int from, int to, List<StreamItem<T>> out) {
    if (from >= to) {
      return;
    }
    String gap = text.substring(from, to);
    if (!gap.isBlank()) {
      out.add(StreamItem.text(gap));
    }
  }

  /**
   * Adds the items for one root: data for matched structures, verbatim text for unmatched ones,
   * and the bracket/key text between them when only part of the root matched.
   */
  static <T> void emitRoot(
      String text, StructureNode root, TypedExtractor<T> extractor, List<StreamItem<T>> out) {
    int cursor = root.start();
    for (ExtractedItem<T> item : extractor.extract(text, root)) {
      StructureNode node = item.node();
      emitGap(text, cursor, node.start(), out);
      if (item instanceof ExtractedItem.Parsed<T> parsed) {
        out.add(StreamItem.data(parsed.value(), node.slice(text)));
      } else {
        out.add(StreamItem.text(node.slice(text)));
      }
      cursor = node.endExclusive();
    }
    emitGap(text, cursor, root.endExclusive(), out);
  }
}
