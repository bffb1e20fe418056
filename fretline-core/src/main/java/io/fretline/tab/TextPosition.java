package io.fretline.tab;

/**
 * Raw cursor position in the host buffer, as a zero-based line and column.
 *
 * @param line line index
 * @param column character offset within the line; may lie past the end of the line
 */
public record TextPosition(int line, int column) {

  public TextPosition {
    if (line < 0 || column < 0) {
      throw new IllegalArgumentException("Negative position: " + line + ":" + column);
    }
  }

  public TextPosition withColumn(int newColumn) {
    return new TextPosition(line, newColumn);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
