package io.fretline.chord;

import io.fretline.tab.Staff;
import io.fretline.tab.StaffGeometry;
import io.fretline.tab.TabDocument;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes chord names into the label line directly above a staff, aligned with the chord's column.
 */
public final class ChordLabeler {

  private static final Logger LOG = LoggerFactory.getLogger(ChordLabeler.class);

  private final TabDocument document;

  public ChordLabeler(TabDocument document) {
    this.document = Objects.requireNonNull(document, "document");
  }

  /**
   * Places {@code analysis}'s chord name above its column. Any label already starting at that
   * column is blanked first; characters beyond the new name's width are left untouched. A label
   * line is inserted when the staff has none.
   *
   * @return number of lines inserted above the staff (0 or 1)
   */
  public int label(Staff staff, ChordAnalysis analysis) {
    int inserted = 0;
    int labelLine = staff.firstLine() - 1;
    if (labelLine < 0 || StaffGeometry.isStringLine(document.line(labelLine))) {
      document.insertLines(staff.firstLine(), List.of(""));
      labelLine = staff.firstLine();
      inserted = 1;
    }
    int column = StaffGeometry.cellColumn(analysis.cellIndex());
    String name = analysis.chordName();

    StringBuilder line = new StringBuilder(document.line(labelLine));
    for (int i = column; i < line.length() && line.charAt(i) != ' '; i++) {
      line.setCharAt(i, ' ');
    }
    while (line.length() < column + name.length()) {
      line.append(' ');
    }
    line.replace(column, column + name.length(), name);
    document.setLine(labelLine, line.toString());
    LOG.debug("Labelled '{}' at line {} column {}", name, labelLine, column);
    return inserted;
  }
}
