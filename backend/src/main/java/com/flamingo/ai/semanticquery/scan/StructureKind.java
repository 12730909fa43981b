package com.flamingo.ai.semanticquery.scan;

/** Which bracket pair opened a structure. */
public enum StructureKind {
  OBJECT('{', '}'),
  ARRAY('[', ']');

  private final char opener;
  private final char closer;

  StructureKind(char opener, char closer) {
    this.opener = opener;
    this.closer = closer;
  }

  public char opener() {
    return opener;
  }

  public char closer() {
    return closer;
  }

  /** Returns the kind opened by {@code c}, or null when {@code c} is not an opening bracket. */
  static StructureKind forOpener(char c) {
    if (c == '{') {
      return OBJECT;
    }
    if (c == '[') {
      return ARRAY;
    }
    return null;
  }
}
