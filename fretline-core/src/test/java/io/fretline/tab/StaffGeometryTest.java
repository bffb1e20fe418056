package io.fretline.tab;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StaffGeometryTest {

  @Test
  void recognizesStringLines() {
    assertTrue(StaffGeometry.isStringLine("e-|---"));
    assertTrue(StaffGeometry.isStringLine("F#|"));
    assertTrue(StaffGeometry.isStringLine("Bb|--0--"));
    assertFalse(StaffGeometry.isStringLine("H-|---"));
    assertFalse(StaffGeometry.isStringLine("e--|--"));
    assertFalse(StaffGeometry.isStringLine(" e-|--"));
    assertFalse(StaffGeometry.isStringLine(""));
    assertFalse(StaffGeometry.isStringLine(null));
  }

  @Test
  void cellColumnsStartAfterPrefixAndMargin() {
    assertEquals(5, StaffGeometry.cellColumn(0));
    assertEquals(8, StaffGeometry.cellColumn(1));
    assertEquals(35, StaffGeometry.cellColumn(10));
  }

  @Test
  void countsWholeCellsOnly() {
    assertEquals(0, StaffGeometry.cellCount(4));
    assertEquals(0, StaffGeometry.cellCount(7));
    assertEquals(1, StaffGeometry.cellCount(8));
    assertEquals(24, StaffGeometry.cellCount(77));
  }

  @Test
  void snapsColumnsToCells() {
    assertEquals(0, StaffGeometry.snapToCell(0, 20));
    assertEquals(0, StaffGeometry.snapToCell(4, 20));
    assertEquals(0, StaffGeometry.snapToCell(7, 20));
    assertEquals(1, StaffGeometry.snapToCell(8, 20));
    assertEquals(1, StaffGeometry.snapToCell(10, 20));
    assertEquals(4, StaffGeometry.snapToCell(19, 20));
    assertEquals(4, StaffGeometry.snapToCell(100, 20));
    assertEquals(-1, StaffGeometry.snapToCell(5, 6));
  }

  @Test
  void buildsBlankLines() {
    assertEquals("e-|-----", StaffGeometry.blankLine("e-|", 8));
    assertThrows(IllegalArgumentException.class, () -> StaffGeometry.blankLine("e|", 20));
    assertThrows(IllegalArgumentException.class, () -> StaffGeometry.blankLine("e-|", 7));
  }
}
