package io.fretline.tab;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CursorModelTest {

  private static final String STAFF =
      String.join(
          "\n",
          "e-|----0---------",
          "B-|----1---------",
          "G-|----0---------",
          "D-|----2--|------",
          "A-|----3---------",
          "E-|--------------");

  private TabDocument doc;
  private CursorModel cursor;

  @BeforeEach
  void setUp() {
    doc = TabDocument.fromText(STAFF + "\n\n" + STAFF);
    cursor = new CursorModel(doc);
  }

  @Test
  void notInTabOutsideStaves() {
    assertTrue(cursor.resolve(new TextPosition(6, 0)).isEmpty());
    assertTrue(cursor.resolve(new TextPosition(40, 0)).isEmpty());
  }

  @Test
  void notInTabWithoutCells() {
    TabDocument bare = TabDocument.fromText("e-|\nB-|\nG-|\nD-|\nA-|\nE-|");
    assertEquals(1, bare.staves().size());
    assertTrue(new CursorModel(bare).resolve(new TextPosition(0, 2)).isEmpty());
  }

  @Test
  void snapsToCellStart() {
    TabContext ctx = cursor.resolve(new TextPosition(0, 9)).orElseThrow();
    assertEquals(new TabContext(0, 0, 0, 1), ctx);
    assertEquals(new TextPosition(0, 8), ctx.position());

    assertEquals(0, cursor.resolve(new TextPosition(2, 0)).orElseThrow().cellIndex());
    assertEquals(3, cursor.resolve(new TextPosition(2, 16)).orElseThrow().cellIndex());
  }

  @Test
  void resolvingANormalizedPositionIsStable() {
    TabContext ctx = cursor.resolve(new TextPosition(4, 13)).orElseThrow();
    assertEquals(ctx, cursor.resolve(ctx.position()).orElseThrow());
  }

  @Test
  void resolvesRawOffsets() {
    int offset = doc.offsetOf(new TextPosition(7, 5));
    assertEquals(new TabContext(1, 7, 0, 0), cursor.resolve(offset).orElseThrow());
  }

  @Test
  void advanceIsClamped() {
    TabContext ctx = new TabContext(0, 0, 0, 1);
    assertEquals(3, cursor.advance(ctx, 10).cellIndex());
    assertEquals(0, cursor.advance(ctx, -5).cellIndex());
    assertEquals(2, cursor.advance(ctx, 1).cellIndex());
    assertTrue(cursor.hasNextCell(ctx));
    assertFalse(cursor.hasNextCell(ctx.withCell(3)));
  }

  @Test
  void moveStringsWrapsWithinStaff() {
    TabContext ctx = new TabContext(0, 0, 0, 2);
    assertEquals(5, cursor.moveStrings(ctx, -1).stringIndex());
    assertEquals(0, cursor.moveStrings(ctx.withString(5), 1).stringIndex());
    assertEquals(1, cursor.moveStrings(ctx, 7).stringIndex());
    assertEquals(0, cursor.moveStrings(ctx, 7).staffIndex());
  }

  @Test
  void moveStaffKeepsStringAndCell() {
    TabContext ctx = new TabContext(0, 0, 4, 2);
    TabContext next = cursor.moveStaff(ctx, Direction.FORWARD).orElseThrow();
    assertEquals(new TabContext(1, 7, 4, 2), next);
    assertEquals(ctx, cursor.moveStaff(next, Direction.BACKWARD).orElseThrow());
    assertTrue(cursor.moveStaff(next, Direction.FORWARD).isEmpty());
    assertTrue(cursor.moveStaff(ctx, Direction.BACKWARD).isEmpty());
  }

  @Test
  void findsBarlinesInEitherDirection() {
    TabContext ctx = new TabContext(0, 0, 3, 0);
    assertEquals(1, cursor.findBarline(ctx, Direction.FORWARD).orElseThrow().cellIndex());
    assertEquals(
        1, cursor.findBarline(ctx.withCell(3), Direction.BACKWARD).orElseThrow().cellIndex());
    assertTrue(cursor.findBarline(ctx.withCell(1), Direction.FORWARD).isEmpty());
    assertTrue(cursor.findBarline(ctx.withString(0), Direction.FORWARD).isEmpty());
  }

  @Test
  void jumpsToLineEnds() {
    TabContext ctx = new TabContext(0, 0, 2, 2);
    assertEquals(0, cursor.lineStart(ctx).cellIndex());
    assertEquals(3, cursor.lineEnd(ctx).cellIndex());
  }
}
