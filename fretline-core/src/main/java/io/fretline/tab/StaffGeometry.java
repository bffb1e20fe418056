package io.fretline.tab;

import java.util.regex.Pattern;

/**
 * Fixed geometry of a string-line.
 *
 * <pre>
 * e-|--0--2--|--3-----
 * ^  ^ ^
 * |  | first cell (column 5), then one cell every 3 columns
 * |  2-character rule margin
 * 3-character prefix: note letter, accidental or '-', literal '|'
 * </pre>
 */
public final class StaffGeometry {

  public static final int STRINGS = 6;
  public static final int PREFIX_WIDTH = 3;
  public static final int FIRST_CELL_COLUMN = 5;

  /** A string-line starts with a note letter, an accidental or dash, and a bar. */
  private static final Pattern STRING_LINE = Pattern.compile("^[A-Ga-g][-#b]\\|.*");

  private StaffGeometry() {}

  public static boolean isStringLine(String line) {
    return line != null && STRING_LINE.matcher(line).matches();
  }

  /** Column at which cell {@code cellIndex} starts. */
  public static int cellColumn(int cellIndex) {
    return FIRST_CELL_COLUMN + cellIndex * Cell.WIDTH;
  }

  /** Number of whole cells that fit in a string-line of the given length. */
  public static int cellCount(int lineLength) {
    return lineLength < FIRST_CELL_COLUMN ? 0 : (lineLength - FIRST_CELL_COLUMN) / Cell.WIDTH;
  }

  /**
   * Snaps a raw column to a cell index: columns left of the first cell map to cell 0, columns
   * inside a cell map to that cell, columns past the last cell map to the last cell.
   *
   * @return the cell index, or -1 if the line holds no cell at all
   */
  public static int snapToCell(int column, int lineLength) {
    int cells = cellCount(lineLength);
    if (cells == 0) {
      return -1;
    }
    if (column < FIRST_CELL_COLUMN) {
      return 0;
    }
    return Math.min((column - FIRST_CELL_COLUMN) / Cell.WIDTH, cells - 1);
  }

  /** Builds a blank string-line of {@code width} characters with the given prefix. */
  public static String blankLine(String prefix, int width) {
    if (prefix.length() != PREFIX_WIDTH) {
      throw new IllegalArgumentException("Prefix must be " + PREFIX_WIDTH + " characters");
    }
    if (width < FIRST_CELL_COLUMN + Cell.WIDTH) {
      throw new IllegalArgumentException("Staff width too small: " + width);
    }
    return prefix + "-".repeat(width - PREFIX_WIDTH);
  }
}
