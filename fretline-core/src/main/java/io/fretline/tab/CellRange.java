package io.fretline.tab;

import io.fretline.api.ErrorCode;
import io.fretline.api.TabEditException;

/**
 * Inclusive range of cells on one staff, covering all six strings.
 *
 * @param staff the staff holding the range
 * @param firstCell first cell, inclusive
 * @param lastCell last cell, inclusive
 */
public record CellRange(Staff staff, int firstCell, int lastCell) {

  public CellRange {
    if (firstCell < 0 || lastCell < firstCell) {
      throw new IllegalArgumentException("Invalid cell range " + firstCell + ".." + lastCell);
    }
  }

  /**
   * Builds the smallest range covering both endpoints, in either order.
   *
   * @throws TabEditException with {@link ErrorCode#REGION_SPANS_MULTIPLE_STAVES} if the endpoints
   *     lie in different staves
   */
  public static CellRange between(TabContext begin, TabContext end) throws TabEditException {
    if (begin.staffIndex() != end.staffIndex()) {
      throw new TabEditException(
          ErrorCode.REGION_SPANS_MULTIPLE_STAVES,
          "Region must lie within a single staff",
          "staves " + begin.staffIndex() + " and " + end.staffIndex());
    }
    return new CellRange(
        begin.staff(),
        Math.min(begin.cellIndex(), end.cellIndex()),
        Math.max(begin.cellIndex(), end.cellIndex()));
  }

  /** Range holding the single column under the context. */
  public static CellRange column(TabContext ctx) {
    return new CellRange(ctx.staff(), ctx.cellIndex(), ctx.cellIndex());
  }

  public int cells() {
    return lastCell - firstCell + 1;
  }

  public int startColumn() {
    return StaffGeometry.cellColumn(firstCell);
  }

  /** Column just past the last cell. */
  public int endColumn() {
    return StaffGeometry.cellColumn(lastCell) + Cell.WIDTH;
  }
}
