package com.flamingo.ai.semanticquery.scan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-pass scanner that finds top-level JSON object/array spans in free-form text.
 *
 * <p>The scanner tracks string literals (including escaped quotes) so that brackets inside a
 * string never affect nesting. A closing bracket always closes whatever structure is on top of the
 * stack; bracket kinds are not cross-checked, which keeps the scan forgiving of slightly malformed
 * input. A closer seen while no structure is open is ignored.
 *
 * <p>The same instance can be fed any number of chunks. The frame stack, the string/escape flags
 * and the running offset survive between calls, so a structure may open in one chunk and close
 * several chunks later. Returned coordinates are offsets into the logical text formed by
 * concatenating every chunk fed so far, less whatever prefix has been dropped through {@link
 * #rebase(int)}. The scanner keeps no reference to the text itself.
 *
 * <p>Instances are not thread-safe and must not be shared between streams.
 */
@Slf4j
public class JsonStructureScanner {

  private final Deque<Frame> frames = new ArrayDeque<>();
  private boolean inString;
  private boolean escape;
  private int offset;

  /**
   * Scans a whole text at once.
   *
   * @param text the text to scan
   * @return every root structure, in the order it closed
   */
  public static List<StructureNode> findStructures(CharSequence text) {
    return new JsonStructureScanner().feed(text);
  }

  /**
   * Scans the next chunk of the stream.
   *
   * @param chunk newly received text
   * @return the root structures closed during this call; structures still open are retained
   */
  public List<StructureNode> feed(CharSequence chunk) {
    List<StructureNode> roots = new ArrayList<>();
    int length = chunk.length();

    for (int i = 0; i < length; i++) {
      char c = chunk.charAt(i);

      if (inString) {
        if (escape) {
          escape = false;
        } else if (c == '\\') {
          escape = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }

      if (c == '"') {
        inString = true;
        continue;
      }

      StructureKind opened = StructureKind.forOpener(c);
      if (opened != null) {
        frames.push(new Frame(offset + i, opened));
      } else if (c == '}' || c == ']') {
        close(offset + i, roots);
      }
    }

    offset += length;
    if (!roots.isEmpty()) {
      log.trace("Closed {} root structure(s), offset now {}", roots.size(), offset);
    }
    return roots;
  }

  private void close(int position, List<StructureNode> roots) {
    Frame frame = frames.poll();
    if (frame == null) {
      return;
    }
    StructureNode node = new StructureNode(frame.start, position, frame.kind, frame.children);
    Frame parent = frames.peek();
    if (parent != null) {
      parent.children.add(node);
    } else {
      roots.add(node);
    }
  }

  /**
   * Moves the coordinate origin {@code delta} characters forward. Open structures and their closed
   * children are rebased with it, so a caller that discards consumed text can keep offsets
   * relative to what it retains.
   *
   * @param delta number of leading characters dropped by the caller
   * @throws IllegalArgumentException if {@code delta} is negative or passes an open structure
   */
  public void rebase(int delta) {
    if (delta < 0 || delta > offset) {
      throw new IllegalArgumentException("Cannot rebase by " + delta + " at offset " + offset);
    }
    int openStart = openRootStart();
    if (openStart >= 0 && delta > openStart) {
      throw new IllegalArgumentException(
          "Cannot rebase by " + delta + " past open structure at " + openStart);
    }
    if (delta == 0) {
      return;
    }
    for (Frame frame : frames) {
      frame.start -= delta;
      frame.children.replaceAll(child -> child.shift(-delta));
    }
    offset -= delta;
  }

  /** Offset of the next character this scanner has not seen yet. */
  public int offset() {
    return offset;
  }

  /** Number of structures currently open. */
  public int depth() {
    return frames.size();
  }

  /** Whether the last character fed left the scanner inside a string literal. */
  public boolean isInString() {
    return inString;
  }

  /** Start offset of the outermost structure still open, or -1 when nothing is open. */
  public int openRootStart() {
    Frame outermost = frames.peekLast();
    return outermost == null ? -1 : outermost.start;
  }

  private static final class Frame {
    private int start;
    private final StructureKind kind;
    private final List<StructureNode> children = new ArrayList<>();

    private Frame(int start, StructureKind kind) {
      this.start = start;
      this.kind = kind;
    }
  }
}
