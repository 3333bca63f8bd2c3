package ows;

import java.util.Comparator;

/** A source position, as reported by the parser that produced the syntax tree. */
public class Pos implements Comparable<Pos> {
  private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

  public static Pos internal() {
    return INTERNAL;
  }

  private final String file;
  private final int lineNumber;
  private final int column;

  public Pos(String file, int lineNumber, int column) {
    this.file = file;
    this.lineNumber = lineNumber;
    this.column = column;
  }

  public String file() {
    return file;
  }

  // Zero-based.
  public int lineNumber() {
    return lineNumber;
  }

  // Zero-based.
  public int column() {
    return column;
  }

  @Override
  public int compareTo(Pos pos) {
    return Comparator.<Pos, String>comparing(p -> p.file())
        .thenComparing(Pos::lineNumber)
        .thenComparing(Pos::column)
        .compare(this, pos);
  }

  @Override
  public String toString() {
    return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
  }
}
