package io.brouwer.parser.api;

/**
 * A 1-based line/column location in a source text.
 *
 * @param line the line number, starting at 1
 * @param column the column number, starting at 1
 */
public record TextPosition(int line, int column) {

  public TextPosition {
    if (line < 1 || column < 1) {
      throw new IllegalArgumentException("Invalid position " + line + ":" + column);
    }
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }
}
