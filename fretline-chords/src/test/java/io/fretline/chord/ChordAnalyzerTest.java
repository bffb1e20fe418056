package io.fretline.chord;

import static org.junit.jupiter.api.Assertions.*;

import io.fretline.api.ErrorCode;
import io.fretline.api.TabEditException;
import io.fretline.tab.Cell;
import io.fretline.tab.EmbKind;
import io.fretline.tab.Staff;
import io.fretline.tab.StaffGeometry;
import io.fretline.tab.TabContext;
import io.fretline.tab.TabDocument;
import io.fretline.tuning.Tuning;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChordAnalyzerTest {

  private TabDocument doc;
  private ChordAnalyzer analyzer;
  private Staff staff;

  @BeforeEach
  void setUp() {
    StringBuilder text = new StringBuilder();
    for (String prefix : Tuning.standard().prefixes()) {
      text.append(StaffGeometry.blankLine(prefix, 17)).append('\n');
    }
    doc = TabDocument.fromText(text.toString());
    staff = doc.staff(0);
    analyzer = new ChordAnalyzer(doc, ChordPatternTable.standard());
  }

  /** Writes a chord shape given low E string first, e.g. {@code "x02220"}, into a column. */
  private void shape(String lowToHigh, int cell) {
    for (int i = 0; i < 6; i++) {
      char c = lowToHigh.charAt(i);
      if (c != 'x') {
        doc.setCell(staff, 5 - i, cell, new Cell.Note(EmbKind.NORMAL, c - '0'));
      }
    }
  }

  private ChordAnalysis analyze(int string, int cell) throws TabEditException {
    return analyzer.analyze(TabContext.of(staff, string, cell), Tuning.standard(), null, false);
  }

  @Test
  void namesMajorTriad() throws TabEditException {
    shape("x02220", 0);

    ChordAnalysis a = analyze(4, 0);

    assertEquals("A", a.chordName());
    assertEquals("", a.disclaimer());
    assertEquals("5 3 rt 5 rt x", a.spelling());
    assertEquals(List.of(4, 7), a.intervals());
    assertEquals(4, a.rootString());
    assertEquals(5, a.rootPitch());
    assertTrue(a.isRecognized());
    assertEquals("A  5 3 rt 5 rt x", a.describe());
  }

  @Test
  void namesMinorTriad() throws TabEditException {
    shape("x02210", 1);

    ChordAnalysis a = analyze(4, 1);

    assertEquals("Am", a.chordName());
    assertEquals("5 b3 rt 5 rt x", a.spelling());
    assertEquals(1, a.cellIndex());
  }

  @Test
  void spellsAllSixStrings() throws TabEditException {
    shape("022100", 0);

    ChordAnalysis a = analyze(5, 0);

    assertEquals("E", a.chordName());
    assertEquals("rt 5 3 rt 5 rt", a.spelling());
  }

  @Test
  void powerChordAndSingleNote() throws TabEditException {
    shape("x355xx", 0);
    shape("x3xxxx", 1);

    assertEquals("C5", analyze(4, 0).chordName());
    ChordAnalysis note = analyze(4, 1);
    assertEquals("C", note.chordName());
    assertEquals("C,note  x x x x rt x", note.describe());
  }

  @Test
  void fallsBackToSlashChordOverBass() throws TabEditException {
    shape("232010", 0);

    ChordAnalysis a = analyze(4, 0);

    assertEquals("C/F#", a.chordName());
    assertEquals("3 rt 5 3 rt b5", a.spelling());
    assertEquals(List.of(4, 7), a.intervals());
  }

  @Test
  void reportsUnknownShapes() throws TabEditException {
    shape("x001xx", 0);

    ChordAnalysis a = analyze(4, 0);

    assertEquals("A??", a.chordName());
    assertFalse(a.isRecognized());
    assertEquals("A??  x x maj7 4 rt x", a.describe());
  }

  @Test
  void rootSearchStartsAtCursorAndWraps() throws TabEditException {
    shape("x02220", 0);

    ChordAnalysis a = analyze(5, 0);

    assertEquals(0, a.rootString());
    assertEquals("E", a.rootName());
  }

  @Test
  void repeatedAnalysisMovesRootToNextFrettedString() throws TabEditException {
    shape("x02220", 0);
    TabContext ctx = TabContext.of(staff, 4, 0);

    ChordAnalysis first = analyzer.analyze(ctx, Tuning.standard(), null, false);
    ChordAnalysis second = analyzer.analyze(ctx, Tuning.standard(), first, false);
    ChordAnalysis third = analyzer.analyze(ctx, Tuning.standard(), second, false);

    assertEquals(4, first.rootString());
    assertEquals(0, second.rootString());
    assertEquals(1, third.rootString());
    assertEquals("C#", third.rootName());
  }

  @Test
  void appendsTwelveToneSpelling() throws TabEditException {
    shape("x02220", 0);

    ChordAnalysis a =
        analyzer.analyze(TabContext.of(staff, 4, 0), Tuning.standard(), null, true);

    assertEquals("5 3 rt 5 rt x (x 0 7 0 4 7)", a.spelling());
  }

  @Test
  void usesActiveTuning() throws TabEditException {
    Tuning dropD = Tuning.fromNames(List.of("e", "B", "G", "D", "A", "d"));
    shape("000xxx", 0);

    ChordAnalysis a = analyzer.analyze(TabContext.of(staff, 5, 0), dropD, null, false);

    assertEquals("D5", a.chordName());
    assertEquals("x x x rt 5 rt", a.spelling());
  }

  @Test
  void keepsUnnormalizedNo3Disclaimer() throws TabEditException {
    // the table writes this row's disclaimer without a leading comma
    shape("x020xx", 0);

    ChordAnalysis a = analyze(4, 0);

    assertEquals("A7", a.chordName());
    assertEquals("no3", a.disclaimer());
    assertEquals("A7no3  x x 7 5 rt x", a.describe());
  }

  @Test
  void emptyColumnHasNoChord() {
    shape("x02220", 0);

    TabEditException e = assertThrows(TabEditException.class, () -> analyze(0, 2));
    assertEquals(ErrorCode.NO_NOTES_IN_CHORD, e.getErrorCode());
  }
}
