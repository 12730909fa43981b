package com.flamingo.ai.semanticquery.stream;

import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.scan.JsonStructureScanner;
import com.flamingo.ai.semanticquery.scan.StructureNode;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Incremental reconciliation of one text stream.
 *
 * <p>Only text after the last closed root structure is kept, and the scanner is rebased every
 * time that prefix is dropped, so its coordinates always index the retained buffer. Memory and
 * offsets therefore grow with the largest structure still open plus the free text since the last
 * root, not with the length of the stream.
 *
 * <p>A session belongs to exactly one stream and is not thread-safe.
 */
@Slf4j
public class ReconcilingSession<T> {

  private final TypedExtractor<T> extractor;
  private final JsonStructureScanner scanner = new JsonStructureScanner();
  private final StringBuilder pending = new StringBuilder();
  private boolean finished;

  ReconcilingSession(TypedExtractor<T> extractor) {
    this.extractor = extractor;
  }

  /**
   * Consumes the next chunk of decoded text.
   *
   * @param chunk newly received text
   * @return the items completed by this chunk, in text order
   */
  public List<StreamItem<T>> accept(String chunk) {
    if (finished) {
      throw new IllegalStateException("Session already finished");
    }
    pending.append(chunk);
    List<StructureNode> roots = scanner.feed(chunk);
    if (roots.isEmpty()) {
      return List.of();
    }

    String text = pending.toString();
    List<StreamItem<T>> items = new ArrayList<>();
    int cursor = 0;
    for (StructureNode root : roots) {
      RootEmitter.emitGap(text, cursor, root.start(), items);
      RootEmitter.emitRoot(text, root, extractor, items);
      cursor = root.endExclusive();
    }

    pending.delete(0, cursor);
    scanner.rebase(cursor);
    log.debug(
        "Reconciled {} root(s) into {} item(s), {} chars pending",
        roots.size(),
        items.size(),
        pending.length());
    return items;
  }

  /**
   * Ends the stream. Text after the last root, including any structure that never closed, is
   * returned as a final text item.
   *
   * @return the trailing items
   */
  public List<StreamItem<T>> finish() {
    if (finished) {
      return List.of();
    }
    finished = true;
    if (scanner.depth() > 0) {
      log.debug("Stream ended with {} unterminated structure(s); kept as text", scanner.depth());
    }
    List<StreamItem<T>> items = new ArrayList<>();
    String tail = pending.toString();
    RootEmitter.emitGap(tail, 0, tail.length(), items);
    pending.setLength(0);
    return items;
  }

  /** Characters held back waiting for a structure to close or the stream to end. */
  public int pendingLength() {
    return pending.length();
  }
}
