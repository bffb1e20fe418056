package io.fretline.tab;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StaffEditorTest {

  private static final List<String> PREFIXES = List.of("e-|", "B-|", "G-|", "D-|", "A-|", "E-|");

  private static final String STAFF =
      String.join(
          "\n",
          "e-|----0---------",
          "B-|----1---------",
          "G-|----0---------",
          "D-|----2--|------",
          "A-|----3---------",
          "E-|--------------");

  private static final String RAGGED =
      String.join(
          "\n",
          "e-|----0-----3---",
          "B-|----1",
          "G-|----0---------",
          "D-|----2---------",
          "A-|----3---------",
          "E-|--------------");

  private TabDocument doc;
  private StaffEditor editor;

  @BeforeEach
  void setUp() {
    doc = TabDocument.fromText(STAFF);
    editor = new StaffEditor(doc, new CursorModel(doc));
  }

  private Staff staff() {
    return doc.staff(0);
  }

  private void assertWidth(int width) {
    for (Staff staff : doc.staves()) {
      for (int s = 0; s < StaffGeometry.STRINGS; s++) {
        assertEquals(width, doc.line(staff.line(s)).length(), "string " + s);
      }
    }
  }

  @Test
  void makeStaffInEmptyDocument() {
    TabDocument empty = TabDocument.empty();
    StaffEditor ed = new StaffEditor(empty, new CursorModel(empty));

    TabContext ctx = ed.makeStaff(new TextPosition(0, 0), 17, PREFIXES);

    assertEquals(new TabContext(0, 3, 0, 0), ctx);
    assertEquals(9, empty.lineCount());
    assertEquals("", empty.line(2));
    assertEquals("e-|--------------", empty.line(3));
    assertEquals("E-|--------------", empty.line(8));
    assertEquals(1, empty.staves().size());
  }

  @Test
  void makeStaffGoesBelowPrecedingStaff() {
    doc.replaceText(STAFF + "\nlyrics");

    TabContext ctx = editor.makeStaff(new TextPosition(6, 3), 20, PREFIXES);

    assertEquals(new TabContext(1, 7, 0, 0), ctx);
    assertEquals("", doc.line(6));
    assertEquals("e-|" + "-".repeat(17), doc.line(7));
    assertEquals("lyrics", doc.line(13));
    assertEquals(2, doc.staves().size());
  }

  @Test
  void insertColumnsShiftsAndCrops() {
    editor.insertColumns(TabContext.of(staff(), 2, 0), 1);

    assertWidth(17);
    assertEquals("e-|-------0------", doc.line(0));
    assertEquals("D-|-------2--|---", doc.line(3));
    assertSame(Cell.BARLINE, doc.cell(staff(), 3, 2));
  }

  @Test
  void insertingAFullStaffOfColumnsBlanksIt() {
    editor.insertColumns(TabContext.of(staff(), 0, 0), 4);

    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      assertEquals(PREFIXES.get(s) + "-".repeat(14), doc.line(s));
    }
  }

  @Test
  void deleteForwardPadsRightEdge() {
    TabContext after = editor.deleteCells(TabContext.of(staff(), 1, 0), 1, Direction.FORWARD);

    assertEquals(0, after.cellIndex());
    assertWidth(17);
    assertEquals("e-|--------------", doc.line(0));
    assertEquals("D-|----|---------", doc.line(3));
  }

  @Test
  void deleteBackwardStopsAtFirstCell() {
    TabContext after = editor.deleteCells(TabContext.of(staff(), 1, 1), 5, Direction.BACKWARD);

    assertEquals(0, after.cellIndex());
    assertEquals("D-|----|---------", doc.line(3));

    String before = doc.toText();
    editor.deleteCells(after, 2, Direction.BACKWARD);
    assertEquals(before, doc.toText());
  }

  @Test
  void deleteForwardNearEndRemovesWhatIsThere() {
    editor.deleteCells(TabContext.of(staff(), 0, 3), 5, Direction.FORWARD);
    assertEquals(STAFF, doc.toText());
    assertWidth(17);
  }

  @Test
  void toggleBarlineSpansAllStrings() {
    TabContext ctx = TabContext.of(staff(), 0, 2);

    TextPosition next = editor.toggleBarline(ctx, true).orElseThrow();

    assertEquals(new TextPosition(0, 14), next);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      assertSame(Cell.BARLINE, doc.cell(staff(), s, 2));
    }

    assertEquals(ctx.position(), editor.toggleBarline(ctx, false).orElseThrow());
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      assertSame(Cell.BLANK, doc.cell(staff(), s, 2));
    }
  }

  @Test
  void toggleBarlineOnLastCellStepsTwoColumns() {
    TextPosition next = editor.toggleBarline(TabContext.of(staff(), 5, 3), true).orElseThrow();
    assertEquals(new TextPosition(5, 16), next);
  }

  @Test
  void toggleBarlineLeavesColumnWithNotes() {
    assertTrue(editor.toggleBarline(TabContext.of(staff(), 5, 0), true).isEmpty());
    assertEquals(STAFF, doc.toText());
  }

  private void useRagged() {
    doc = TabDocument.fromText(RAGGED);
    editor = new StaffEditor(doc, new CursorModel(doc));
  }

  @Test
  void insertPadsShortStringLines() {
    useRagged();

    editor.insertColumns(TabContext.of(staff(), 0, 1), 1);

    assertWidth(17);
    assertEquals("e-|----0--------3", doc.line(0));
    assertEquals("B-|----1---------", doc.line(1));
    assertEquals(new Cell.Note(EmbKind.NORMAL, 3), doc.cell(staff(), 0, 3));
  }

  @Test
  void yankPadsShortStringLines() {
    useRagged();
    RectangleClip clip = editor.kill(new CellRange(staff(), 0, 0), false);

    editor.yank(TabContext.of(staff(), 2, 2), clip);

    assertWidth(17);
    assertEquals("B-|----1-----1---", doc.line(1));
    assertEquals("e-|----0-----0--3", doc.line(0));
  }

  @Test
  void barlineOnRaggedStaffCoversEveryString() {
    useRagged();

    editor.toggleBarline(TabContext.of(staff(), 3, 3), false).orElseThrow();

    assertWidth(17);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      assertSame(Cell.BARLINE, doc.cell(staff(), s, 3));
    }
  }

  @Test
  void killThenYankRestores() {
    CellRange range = new CellRange(staff(), 0, 1);

    RectangleClip clip = editor.kill(range, true);

    assertEquals(6, clip.width());
    assertEquals("--0---", clip.row(0));
    assertEquals("--2--|", clip.row(3));
    assertEquals("e-|--------------", doc.line(0));
    assertWidth(17);

    editor.yank(TabContext.of(staff(), 0, 0), clip);
    assertEquals(STAFF, doc.toText());
  }

  @Test
  void copyLeavesSourceAlone() {
    RectangleClip clip = editor.kill(new CellRange(staff(), 0, 0), false);

    assertEquals(STAFF, doc.toText());
    assertEquals("--3", clip.row(4));

    editor.yank(TabContext.of(staff(), 0, 2), clip);
    assertWidth(17);
    assertEquals(new Cell.Note(EmbKind.NORMAL, 3), doc.cell(staff(), 4, 2));
    assertEquals(new Cell.Note(EmbKind.NORMAL, 3), doc.cell(staff(), 4, 0));
  }

  @Test
  void writesAndClearsSingleCells() {
    TabContext ctx = TabContext.of(staff(), 5, 1);
    editor.writeCell(ctx, 5, new Cell.Note(EmbKind.NORMAL, 3));
    assertEquals("E-|-------3------", doc.line(5));
    editor.clearCell(ctx);
    assertEquals("E-|--------------", doc.line(5));
  }

  @Test
  void rejectsNonPositiveCounts() {
    TabContext ctx = TabContext.of(staff(), 0, 0);
    assertThrows(IllegalArgumentException.class, () -> editor.insertColumns(ctx, 0));
    assertThrows(
        IllegalArgumentException.class, () -> editor.deleteCells(ctx, -1, Direction.FORWARD));
  }
}
