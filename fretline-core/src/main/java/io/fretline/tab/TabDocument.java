package io.fretline.tab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Line-oriented model of the host buffer. Staves are not stored separately: they are recognized
 * from the text as runs of six consecutive string-lines whose prefixes have pairwise distinct first
 * characters, scanning top to bottom so that two adjacent staves split cleanly.
 *
 * <p>Not thread-safe; a document is owned by one session.
 */
public final class TabDocument {

  private final List<String> lines;
  private List<Staff> staves;

  private TabDocument(List<String> lines) {
    this.lines = lines;
  }

  /** Creates an empty document (a single empty line). */
  public static TabDocument empty() {
    List<String> lines = new ArrayList<>();
    lines.add("");
    return new TabDocument(lines);
  }

  /** Splits {@code text} on {@code '\n'}; a trailing newline yields a final empty line. */
  public static TabDocument fromText(String text) {
    Objects.requireNonNull(text, "text");
    List<String> lines = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        lines.add(text.substring(start, i));
        start = i + 1;
      }
    }
    lines.add(text.substring(start));
    return new TabDocument(lines);
  }

  /** Replaces the whole content with {@code text}, as delivered by the host. */
  public void replaceText(String text) {
    List<String> fresh = fromText(text).lines;
    lines.clear();
    lines.addAll(fresh);
    staves = null;
  }

  public String toText() {
    return String.join("\n", lines);
  }

  public TabDocument copy() {
    return new TabDocument(new ArrayList<>(lines));
  }

  public int lineCount() {
    return lines.size();
  }

  public String line(int index) {
    return lines.get(index);
  }

  public List<String> lines() {
    return Collections.unmodifiableList(lines);
  }

  public void setLine(int index, String text) {
    lines.set(index, Objects.requireNonNull(text, "text"));
    staves = null;
  }

  public void insertLines(int at, List<String> newLines) {
    lines.addAll(at, newLines);
    staves = null;
  }

  /** Appends empty lines until the document has at least {@code count} lines. */
  public void ensureLineCount(int count) {
    while (lines.size() < count) {
      lines.add("");
    }
    staves = null;
  }

  // ---- raw offsets ----

  public int offsetOf(TextPosition pos) {
    int offset = 0;
    for (int i = 0; i < pos.line(); i++) {
      offset += lines.get(i).length() + 1;
    }
    return offset + Math.min(pos.column(), lines.get(pos.line()).length());
  }

  public TextPosition positionAt(int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("Negative offset: " + offset);
    }
    int remaining = offset;
    for (int i = 0; i < lines.size(); i++) {
      int len = lines.get(i).length();
      if (remaining <= len) {
        return new TextPosition(i, remaining);
      }
      remaining -= len + 1;
    }
    int last = lines.size() - 1;
    return new TextPosition(last, lines.get(last).length());
  }

  /**
   * Inserts literal text at {@code pos}, padding the line with spaces if the position lies past its
   * end. Embedded newlines split lines.
   *
   * @return the position just after the inserted text
   */
  public TextPosition insertText(TextPosition pos, String text) {
    String line = lines.get(pos.line());
    if (line.length() < pos.column()) {
      line = line + " ".repeat(pos.column() - line.length());
    }
    String head = line.substring(0, pos.column()) + text;
    String tail = line.substring(pos.column());
    String[] parts = head.split("\n", -1);
    lines.set(pos.line(), parts[0]);
    for (int i = 1; i < parts.length; i++) {
      lines.add(pos.line() + i, parts[i]);
    }
    int lastLine = pos.line() + parts.length - 1;
    int column = lines.get(lastLine).length();
    lines.set(lastLine, lines.get(lastLine) + tail);
    staves = null;
    return new TextPosition(lastLine, column);
  }

  // ---- staves ----

  public List<Staff> staves() {
    if (staves == null) {
      staves = Collections.unmodifiableList(scanStaves());
    }
    return staves;
  }

  public Staff staff(int index) {
    return staves().get(index);
  }

  public Optional<Staff> staffAtLine(int line) {
    for (Staff staff : staves()) {
      if (staff.containsLine(line)) {
        return Optional.of(staff);
      }
      if (staff.firstLine() > line) {
        break;
      }
    }
    return Optional.empty();
  }

  /** Width of a staff, the length of its longest string-line. */
  public int width(Staff staff) {
    int width = 0;
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      width = Math.max(width, lines.get(staff.line(s)).length());
    }
    return width;
  }

  /**
   * Pads each string-line of {@code staff} with {@code -} up to the staff width, so host text with
   * ragged string-lines can be edited column-wise.
   *
   * @return the staff width
   */
  public int alignStrings(Staff staff) {
    int width = width(staff);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      int lineIndex = staff.line(s);
      String line = lines.get(lineIndex);
      if (line.length() < width) {
        lines.set(lineIndex, line + "-".repeat(width - line.length()));
        staves = null;
      }
    }
    return width;
  }

  public int cellCount(Staff staff) {
    return StaffGeometry.cellCount(width(staff));
  }

  public Cell cell(Staff staff, int stringIndex, int cellIndex) {
    String line = lines.get(staff.line(stringIndex));
    int col = StaffGeometry.cellColumn(cellIndex);
    if (col >= line.length()) {
      return Cell.BLANK;
    }
    return Cell.parse(line.substring(col, Math.min(col + Cell.WIDTH, line.length())));
  }

  public void setCell(Staff staff, int stringIndex, int cellIndex, Cell cell) {
    int lineIndex = staff.line(stringIndex);
    String line = lines.get(lineIndex);
    int col = StaffGeometry.cellColumn(cellIndex);
    if (col + Cell.WIDTH > line.length()) {
      throw new IllegalArgumentException(
          "Cell " + cellIndex + " lies outside string-line of width " + line.length());
    }
    lines.set(lineIndex, line.substring(0, col) + cell.render() + line.substring(col + Cell.WIDTH));
    staves = null;
  }

  private List<Staff> scanStaves() {
    List<Staff> found = new ArrayList<>();
    int i = 0;
    while (i + StaffGeometry.STRINGS <= lines.size()) {
      if (isStaffAt(i)) {
        found.add(new Staff(found.size(), i));
        i += StaffGeometry.STRINGS;
      } else {
        i++;
      }
    }
    return found;
  }

  private boolean isStaffAt(int first) {
    Set<Character> seen = new HashSet<>();
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      String line = lines.get(first + s);
      if (!StaffGeometry.isStringLine(line) || !seen.add(line.charAt(0))) {
        return false;
      }
    }
    return true;
  }
}
