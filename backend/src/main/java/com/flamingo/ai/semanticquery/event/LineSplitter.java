package com.flamingo.ai.semanticquery.event;

import java.util.ArrayList;
import java.util.List;

/** Splits decoded text chunks into lines, holding back a line until its terminator arrives. */
class LineSplitter {

  private final StringBuilder partial = new StringBuilder();

  /** Returns the lines completed by {@code text}, without terminators. */
  List<String> push(String text) {
    List<String> lines = new ArrayList<>();
    partial.append(text);
    int newline;
    while ((newline = partial.indexOf("\n")) >= 0) {
      lines.add(stripCarriageReturn(partial.substring(0, newline)));
      partial.delete(0, newline + 1);
    }
    return lines;
  }

  /** Returns the lines completed by {@code text} plus any unterminated last line. */
  List<String> finish(String text) {
    List<String> lines = push(text);
    if (partial.length() > 0) {
      lines.add(stripCarriageReturn(partial.toString()));
      partial.setLength(0);
    }
    return lines;
  }

  private static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
