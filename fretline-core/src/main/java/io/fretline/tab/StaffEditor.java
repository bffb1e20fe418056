package io.fretline.tab;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural edits on staves: creation, column insert and delete, barlines, rectangular kill and
 * yank, and single-cell writes.
 *
 * <p>Staff width is fixed. Every edit that inserts cells crops each string-line back to its
 * original length, discarding whatever was pushed past the right edge; every edit that removes
 * cells pads the right edge with blank cells. All six strings of a staff are edited together so
 * their lengths and barline columns stay aligned; a staff whose string-lines differ in length is
 * first padded to its longest line.
 */
public final class StaffEditor {

  private static final Logger LOG = LoggerFactory.getLogger(StaffEditor.class);

  private final TabDocument document;
  private final CursorModel cursor;

  public StaffEditor(TabDocument document, CursorModel cursor) {
    this.document = Objects.requireNonNull(document, "document");
    this.cursor = Objects.requireNonNull(cursor, "cursor");
  }

  /**
   * Inserts a blank lyric line followed by a new six-string staff below the nearest staff at or
   * above {@code pos}, or three lines below {@code pos} when no staff precedes it.
   *
   * @param pos raw cursor position
   * @param width length of each string-line
   * @param prefixes the six string prefixes, high string first
   * @return context of the first cell of string 0 of the new staff
   */
  public TabContext makeStaff(TextPosition pos, int width, List<String> prefixes) {
    if (prefixes.size() != StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("Need six prefixes, got " + prefixes.size());
    }
    Staff preceding = null;
    for (Staff staff : document.staves()) {
      if (staff.firstLine() <= pos.line()) {
        preceding = staff;
      }
    }
    int at;
    if (preceding != null) {
      at = preceding.lastLine() + 1;
    } else {
      at = pos.line() + 2;
      document.ensureLineCount(at);
    }
    List<String> block = new ArrayList<>(StaffGeometry.STRINGS + 1);
    block.add("");
    for (String prefix : prefixes) {
      block.add(StaffGeometry.blankLine(prefix, width));
    }
    document.insertLines(at, block);
    Staff created =
        document
            .staffAtLine(at + 1)
            .orElseThrow(() -> new IllegalStateException("New staff not recognized at " + at));
    LOG.debug("Created staff {} at line {} with width {}", created.index(), at + 1, width);
    return TabContext.of(created, 0, 0);
  }

  /**
   * Inserts {@code count} blank cells at the context's cell on all six strings, then crops each
   * string-line back to its original width.
   */
  public void insertColumns(TabContext ctx, int count) {
    requireCount(count);
    insertRows(ctx, "---".repeat(count), count);
  }

  /**
   * Removes {@code count} whole cells from all six strings and pads each string-line at its right
   * end with as many blank cells.
   *
   * <p>Forward removes the cell under the cursor and the ones after it. Backward removes the cells
   * before the cursor, never reaching past the first cell.
   *
   * @return the cursor position after the delete
   */
  public TabContext deleteCells(TabContext ctx, int count, Direction direction) {
    requireCount(count);
    int cells = StaffGeometry.cellCount(document.alignStrings(ctx.staff()));
    int first;
    int removed;
    if (direction == Direction.FORWARD) {
      first = ctx.cellIndex();
      removed = Math.min(count, cells - first);
    } else {
      first = Math.max(0, ctx.cellIndex() - count);
      removed = ctx.cellIndex() - first;
    }
    if (removed <= 0) {
      return ctx;
    }
    cutRows(new CellRange(ctx.staff(), first, first + removed - 1), true);
    LOG.debug(
        "Deleted {} cell(s) {} from cell {} of staff {}",
        removed,
        direction,
        ctx.cellIndex(),
        ctx.staffIndex());
    return ctx.withCell(first);
  }

  /**
   * Flips the column under the cursor between barline and blank on all six strings. A column that
   * holds a note on any string is left as it is.
   *
   * @param advanceCursor whether to move past the toggled column
   * @return the new raw cursor position: one cell forward if room remains on the line, otherwise
   *     two characters forward; empty if the column holds notes
   */
  public Optional<TextPosition> toggleBarline(TabContext ctx, boolean advanceCursor) {
    Staff staff = ctx.staff();
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      if (document.cell(staff, s, ctx.cellIndex()) instanceof Cell.Note) {
        LOG.debug(
            "Cell {} of staff {} holds a note on string {}, barline not toggled",
            ctx.cellIndex(),
            ctx.staffIndex(),
            s);
        return Optional.empty();
      }
    }
    document.alignStrings(staff);
    boolean isBar =
        document.cell(staff, ctx.stringIndex(), ctx.cellIndex()) instanceof Cell.Barline;
    Cell replacement = isBar ? Cell.BLANK : Cell.BARLINE;
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      document.setCell(staff, s, ctx.cellIndex(), replacement);
    }
    LOG.debug(
        "{} barline at cell {} of staff {}",
        isBar ? "Removed" : "Added",
        ctx.cellIndex(),
        ctx.staffIndex());
    if (!advanceCursor) {
      return Optional.of(ctx.position());
    }
    if (cursor.hasNextCell(ctx)) {
      return Optional.of(cursor.advance(ctx, 1).position());
    }
    return Optional.of(ctx.position().withColumn(ctx.column() + 2));
  }

  /**
   * Copies the rectangle covered by {@code range} on all six strings, optionally removing it from
   * the staff. Removal pads each string-line's right end so the staff keeps its width.
   */
  public RectangleClip kill(CellRange range, boolean deleteSource) {
    RectangleClip clip = cutRows(range, deleteSource);
    LOG.debug(
        "{} cells {}..{} of staff {}",
        deleteSource ? "Killed" : "Copied",
        range.firstCell(),
        range.lastCell(),
        range.staff().index());
    return clip;
  }

  /**
   * Inserts a killed rectangle at the context's cell, shifting existing content right and cropping
   * at the original width.
   */
  public void yank(TabContext ctx, RectangleClip clip) {
    Objects.requireNonNull(clip, "clip");
    Staff staff = ctx.staff();
    int col = ctx.column();
    document.alignStrings(staff);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      int lineIndex = staff.line(s);
      String line = document.line(lineIndex);
      String inserted = line.substring(0, col) + clip.row(s) + line.substring(col);
      document.setLine(lineIndex, inserted.substring(0, line.length()));
    }
    LOG.debug(
        "Yanked {} column(s) at cell {} of staff {}", clip.width(), ctx.cellIndex(), staff.index());
  }

  /** Writes a single cell on one string of the context's staff. */
  public void writeCell(TabContext ctx, int stringIndex, Cell cell) {
    document.alignStrings(ctx.staff());
    document.setCell(ctx.staff(), stringIndex, ctx.cellIndex(), cell);
  }

  /** Blanks the cell under the cursor. */
  public void clearCell(TabContext ctx) {
    writeCell(ctx, ctx.stringIndex(), Cell.BLANK);
  }

  private void insertRows(TabContext ctx, String block, int count) {
    Staff staff = ctx.staff();
    int col = ctx.column();
    document.alignStrings(staff);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      int lineIndex = staff.line(s);
      String line = document.line(lineIndex);
      String inserted = line.substring(0, col) + block + line.substring(col);
      document.setLine(lineIndex, inserted.substring(0, line.length()));
    }
    LOG.debug(
        "Inserted {} column(s) at cell {} of staff {}", count, ctx.cellIndex(), staff.index());
  }

  private RectangleClip cutRows(CellRange range, boolean delete) {
    Staff staff = range.staff();
    int start = range.startColumn();
    int end = range.endColumn();
    if (delete) {
      document.alignStrings(staff);
    }
    List<String> rows = new ArrayList<>(StaffGeometry.STRINGS);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      int lineIndex = staff.line(s);
      String line = document.line(lineIndex);
      int from = Math.min(start, line.length());
      int to = Math.min(end, line.length());
      String row = line.substring(from, to);
      rows.add(row + "-".repeat(end - start - row.length()));
      if (delete) {
        document.setLine(
            lineIndex, line.substring(0, from) + line.substring(to) + "-".repeat(to - from));
      }
    }
    return new RectangleClip(rows);
  }

  private static void requireCount(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Count must be positive: " + count);
    }
  }
}
