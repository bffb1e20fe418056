package io.fretline.tab;

/**
 * A cursor position that has been validated as lying inside a staff and snapped to a cell
 * boundary.
 *
 * @param staffIndex index of the enclosing staff in the document
 * @param firstLine document line of the staff's string 0
 * @param stringIndex 0 (high e) to 5 (low E)
 * @param cellIndex zero-based cell on the string-line
 */
public record TabContext(int staffIndex, int firstLine, int stringIndex, int cellIndex) {

  public TabContext {
    if (stringIndex < 0 || stringIndex >= StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("String index out of range: " + stringIndex);
    }
    if (cellIndex < 0) {
      throw new IllegalArgumentException("Negative cell index: " + cellIndex);
    }
  }

  public static TabContext of(Staff staff, int stringIndex, int cellIndex) {
    return new TabContext(staff.index(), staff.firstLine(), stringIndex, cellIndex);
  }

  public Staff staff() {
    return new Staff(staffIndex, firstLine);
  }

  public int line() {
    return firstLine + stringIndex;
  }

  public int column() {
    return StaffGeometry.cellColumn(cellIndex);
  }

  public TextPosition position() {
    return new TextPosition(line(), column());
  }

  public TabContext withCell(int newCell) {
    return new TabContext(staffIndex, firstLine, stringIndex, newCell);
  }

  public TabContext withString(int newString) {
    return new TabContext(staffIndex, firstLine, newString, cellIndex);
  }
}
