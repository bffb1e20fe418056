package io.fretline.tab;

import java.util.List;

/**
 * Rectangular block of cells cut from one staff: one row of text per string, all of the same
 * width.
 */
public record RectangleClip(List<String> rows) {

  public RectangleClip {
    rows = List.copyOf(rows);
    if (rows.size() != StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("Clip must hold one row per string, got " + rows.size());
    }
  }

  public int width() {
    return rows.get(0).length();
  }

  public String row(int stringIndex) {
    return rows.get(stringIndex);
  }
}
