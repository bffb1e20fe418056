package io.fretline.tab;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps raw cursor positions to {@link TabContext}s. This is the single source of truth for "am I
 * inside tab": every tab-aware command resolves through here and falls back to literal text
 * insertion when {@link #resolve} returns empty.
 *
 * <p>Resolution snaps on every query, so resolving an already-normalized position is the identity.
 */
public final class CursorModel {

  private final TabDocument document;

  public CursorModel(TabDocument document) {
    this.document = Objects.requireNonNull(document, "document");
  }

  /**
   * Resolves a raw position.
   *
   * @param pos raw position in the host buffer
   * @return the snapped tab context, or empty if the position is not on a staff's string-line
   */
  public Optional<TabContext> resolve(TextPosition pos) {
    if (pos.line() >= document.lineCount()) {
      return Optional.empty();
    }
    Optional<Staff> staff = document.staffAtLine(pos.line());
    if (staff.isEmpty()) {
      return Optional.empty();
    }
    int cell = StaffGeometry.snapToCell(pos.column(), document.line(pos.line()).length());
    if (cell < 0) {
      return Optional.empty();
    }
    return Optional.of(TabContext.of(staff.get(), pos.line() - staff.get().firstLine(), cell));
  }

  /** Resolves a raw character offset into the buffer. */
  public Optional<TabContext> resolve(int offset) {
    return resolve(document.positionAt(offset));
  }

  /** Moves by whole cells along the same string-line, clamped to the line's cells. */
  public TabContext advance(TabContext ctx, int deltaCells) {
    int last = lastCell(ctx);
    int target = Math.max(0, Math.min(last, ctx.cellIndex() + deltaCells));
    return ctx.withCell(target);
  }

  /** Whether one more cell exists to the right of the context. */
  public boolean hasNextCell(TabContext ctx) {
    return ctx.cellIndex() < lastCell(ctx);
  }

  /**
   * Moves across strings of the same staff, wrapping modulo six. Never leaves the staff; moving to
   * another staff is {@link #moveStaff}.
   */
  public TabContext moveStrings(TabContext ctx, int deltaStrings) {
    int target = Math.floorMod(ctx.stringIndex() + deltaStrings, StaffGeometry.STRINGS);
    TabContext moved = ctx.withString(target);
    int last = lastCell(moved);
    return moved.cellIndex() > last ? moved.withCell(last) : moved;
  }

  /**
   * Moves to the same string and cell of the next or previous staff.
   *
   * @return the new context, or empty if no staff exists in that direction
   */
  public Optional<TabContext> moveStaff(TabContext ctx, Direction direction) {
    List<Staff> staves = document.staves();
    int target = ctx.staffIndex() + direction.sign();
    if (target < 0 || target >= staves.size()) {
      return Optional.empty();
    }
    Staff staff = staves.get(target);
    int cells = document.cellCount(staff);
    if (cells == 0) {
      return Optional.empty();
    }
    return Optional.of(
        TabContext.of(staff, ctx.stringIndex(), Math.min(ctx.cellIndex(), cells - 1)));
  }

  /**
   * Finds the nearest barline strictly after (or before) the context on the same string.
   *
   * @return the barline's context, or empty if there is none in that direction
   */
  public Optional<TabContext> findBarline(TabContext ctx, Direction direction) {
    Staff staff = ctx.staff();
    int last = lastCell(ctx);
    for (int c = ctx.cellIndex() + direction.sign(); c >= 0 && c <= last; c += direction.sign()) {
      if (document.cell(staff, ctx.stringIndex(), c) instanceof Cell.Barline) {
        return Optional.of(ctx.withCell(c));
      }
    }
    return Optional.empty();
  }

  /** First cell of the context's string-line. */
  public TabContext lineStart(TabContext ctx) {
    return ctx.withCell(0);
  }

  /** Last cell of the context's string-line. */
  public TabContext lineEnd(TabContext ctx) {
    return ctx.withCell(lastCell(ctx));
  }

  private int lastCell(TabContext ctx) {
    return StaffGeometry.cellCount(document.line(ctx.line()).length()) - 1;
  }
}
