package io.fretline.tuning;

import io.fretline.tab.Cell;
import io.fretline.tab.CellRange;
import io.fretline.tab.Staff;
import io.fretline.tab.StaffGeometry;
import io.fretline.tab.TabContext;
import io.fretline.tab.TabDocument;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fret arithmetic over regions of a staff: transposition, octave shifts and retuned copies. */
public final class Transposer {

  private static final Logger LOG = LoggerFactory.getLogger(Transposer.class);

  /** Direction of an octave shift. */
  public enum Octave {
    UP,
    DOWN
  }

  private final TabDocument document;
  private final TuningModel tuning;

  public Transposer(TabDocument document, TuningModel tuning) {
    this.document = Objects.requireNonNull(document, "document");
    this.tuning = Objects.requireNonNull(tuning, "tuning");
  }

  /**
   * Shifts every fretted note in {@code range} by the delta of its string. Results below zero are
   * raised an octave, results above {@link Cell#MAX_FRET} lowered one.
   *
   * @param perStringDeltas six deltas in semitones, high string first
   * @return number of notes rewritten
   */
  public int transpose(CellRange range, int[] perStringDeltas) {
    if (perStringDeltas.length != StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("Need six deltas, got " + perStringDeltas.length);
    }
    Staff staff = range.staff();
    int lastCell = document.cellCount(staff) - 1;
    int changed = 0;
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      int delta = perStringDeltas[s];
      if (delta == 0) {
        continue;
      }
      for (int c = range.firstCell(); c <= Math.min(range.lastCell(), lastCell); c++) {
        if (document.cell(staff, s, c) instanceof Cell.Note note) {
          document.setCell(staff, s, c, note.withFret(wrapFret(note.fret() + delta)));
          changed++;
        }
      }
    }
    LOG.debug(
        "Transposed {} note(s) in cells {}..{} of staff {}",
        changed,
        range.firstCell(),
        range.lastCell(),
        staff.index());
    return changed;
  }

  /** Transposes all strings of {@code range} by the same amount. */
  public int transpose(CellRange range, int delta) {
    int[] deltas = new int[StaffGeometry.STRINGS];
    Arrays.fill(deltas, delta);
    return transpose(range, deltas);
  }

  /**
   * Moves the note under the cursor an octave up (only from fret 12 or below) or down (only from
   * fret 12 or above). Anything else is left alone.
   *
   * @return whether the note was changed
   */
  public boolean octaveShift(TabContext ctx, Octave octave) {
    Staff staff = ctx.staff();
    if (!(document.cell(staff, ctx.stringIndex(), ctx.cellIndex()) instanceof Cell.Note note)) {
      return false;
    }
    if (octave == Octave.UP && note.fret() <= 12) {
      document.setCell(staff, ctx.stringIndex(), ctx.cellIndex(), note.withFret(note.fret() + 12));
      return true;
    }
    if (octave == Octave.DOWN && note.fret() >= 12) {
      document.setCell(staff, ctx.stringIndex(), ctx.cellIndex(), note.withFret(note.fret() - 12));
      return true;
    }
    return false;
  }

  /**
   * Copies the source staff below the first blank line that follows it, relabels the copy with the
   * active tuning's prefixes and transposes each string so the copy sounds the same chord shapes in
   * the active tuning. Each string moves by the smaller of the two directions to its old pitch,
   * within (-6, 6].
   *
   * @return context at the same string and cell of the new staff
   */
  public TabContext copyRetune(TabContext source) {
    Staff sourceStaff = source.staff();
    Tuning old = tuning.read(sourceStaff);
    Tuning now = tuning.current();
    int[] diff = new int[StaffGeometry.STRINGS];
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      diff[s] = nearestShift(old.pitch(s) - now.pitch(s));
    }

    int blank = sourceStaff.lastLine() + 1;
    while (blank < document.lineCount() && !document.line(blank).isBlank()) {
      blank++;
    }
    if (blank >= document.lineCount()) {
      document.ensureLineCount(blank + 1);
    }
    int at = blank + 1;
    List<String> copy = new ArrayList<>(StaffGeometry.STRINGS + 1);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      String line = document.line(sourceStaff.line(s));
      copy.add(now.prefix(s) + line.substring(StaffGeometry.PREFIX_WIDTH));
    }
    if (at < document.lineCount()) {
      copy.add("");
    }
    document.insertLines(at, copy);

    Staff created =
        document
            .staffAtLine(at)
            .orElseThrow(() -> new IllegalStateException("Copied staff not recognized at " + at));
    int cells = document.cellCount(created);
    if (cells > 0) {
      transpose(new CellRange(created, 0, cells - 1), diff);
    }
    LOG.debug(
        "Copied staff {} to staff {} retuned from {} to {}",
        sourceStaff.index(),
        created.index(),
        old,
        now);
    return TabContext.of(created, source.stringIndex(), Math.min(source.cellIndex(), cells - 1));
  }

  /** Normalizes a semitone difference into (-6, 6]. */
  static int nearestShift(int semitones) {
    int d = Math.floorMod(semitones, 12);
    return d > 6 ? d - 12 : d;
  }

  private static int wrapFret(int fret) {
    while (fret < 0) {
      fret += 12;
    }
    while (fret > Cell.MAX_FRET) {
      fret -= 12;
    }
    return fret;
  }
}
