package io.fretline.tuning;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NoteNamesTest {

  @Test
  void countsFromE() {
    assertEquals(0, NoteNames.parse("E"));
    assertEquals(0, NoteNames.parse("e"));
    assertEquals(5, NoteNames.parse("A"));
    assertEquals(7, NoteNames.parse("B"));
    assertEquals(8, NoteNames.parse("C"));
    assertEquals(10, NoteNames.parse("D"));
  }

  @Test
  void appliesAccidentals() {
    assertEquals(2, NoteNames.parse("F#"));
    assertEquals(6, NoteNames.parse("Bb"));
    assertEquals(11, NoteNames.parse("Eb"));
    assertEquals(8, NoteNames.parse("B#"));
    assertEquals(0, NoteNames.parse("Fb"));
  }

  @Test
  void namesPitchClasses() {
    assertEquals("E", NoteNames.name(0));
    assertEquals("F#", NoteNames.name(2));
    assertEquals("Bb", NoteNames.name(6));
    assertEquals("Eb", NoteNames.name(11));
    assertEquals("E", NoteNames.name(12));
    assertEquals("Eb", NoteNames.name(-1));
  }

  @Test
  void validatesNames() {
    assertTrue(NoteNames.isValidName("g"));
    assertTrue(NoteNames.isValidName("C#"));
    assertFalse(NoteNames.isValidName("H"));
    assertFalse(NoteNames.isValidName("C##"));
    assertFalse(NoteNames.isValidName(""));
    assertFalse(NoteNames.isValidName(null));
    assertThrows(IllegalArgumentException.class, () -> NoteNames.parse("X"));
  }

  @Test
  void buildsPrefixes() {
    assertEquals("e-|", NoteNames.prefix("e"));
    assertEquals("F#|", NoteNames.prefix("F#"));
    assertEquals("Bb|", NoteNames.prefix("Bb"));
  }
}
