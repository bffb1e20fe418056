package io.fretline.chord;

import io.fretline.api.ErrorCode;
import io.fretline.api.TabEditException;
import io.fretline.tab.Cell;
import io.fretline.tab.Staff;
import io.fretline.tab.StaffGeometry;
import io.fretline.tab.TabContext;
import io.fretline.tab.TabDocument;
import io.fretline.tuning.NoteNames;
import io.fretline.tuning.Tuning;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names the chord found in one staff column.
 *
 * <p>Steps:
 *
 * <ol>
 *   <li>Pick the root: the note under the cursor, or on a repeated request the next fretted string
 *       after the previous root, wrapping over the six strings.
 *   <li>Collect pitch classes {@code (fret + tuning[string]) mod 12}, counting occurrences. The
 *       lowest sounding string, processed last, is the bass candidate.
 *   <li>Build the ascending distinct intervals of the non-root classes and look them up in the
 *       {@link ChordPatternTable} for their note count.
 *   <li>If nothing matches and the bass is a single non-root note, retry without it and name the
 *       result as a slash chord over the bass.
 *   <li>Spell each string with its degree label, high string first.
 * </ol>
 */
public final class ChordAnalyzer {

  private static final Logger LOG = LoggerFactory.getLogger(ChordAnalyzer.class);

  private final TabDocument document;
  private final ChordPatternTable table;

  public ChordAnalyzer(TabDocument document, ChordPatternTable table) {
    this.document = Objects.requireNonNull(document, "document");
    this.table = Objects.requireNonNull(table, "table");
  }

  /**
   * Analyzes the column under the cursor.
   *
   * @param ctx cursor context
   * @param tuning active tuning
   * @param previous the analysis this call repeats, or null for a fresh analysis
   * @param twelveToneSpelling whether to append the numeric spelling
   * @throws TabEditException with {@link ErrorCode#NO_NOTES_IN_CHORD} if the column holds no note
   */
  public ChordAnalysis analyze(
      TabContext ctx, Tuning tuning, ChordAnalysis previous, boolean twelveToneSpelling)
      throws TabEditException {
    Staff staff = ctx.staff();
    int[] frets = new int[StaffGeometry.STRINGS];
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      Cell cell = document.cell(staff, s, ctx.cellIndex());
      frets[s] = cell instanceof Cell.Note note ? note.fret() : -1;
    }

    int rootString;
    if (previous != null) {
      rootString = nextFretted(frets, previous.rootString() + 1);
    } else {
      rootString = nextFretted(frets, ctx.stringIndex());
    }
    if (rootString < 0) {
      throw new TabEditException(
          ErrorCode.NO_NOTES_IN_CHORD,
          "No fretted note in this column",
          "staff " + ctx.staffIndex() + ", cell " + ctx.cellIndex());
    }

    int[] counts = new int[12];
    int[] pitches = new int[StaffGeometry.STRINGS];
    int bass = -1;
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      if (frets[s] < 0) {
        pitches[s] = -1;
        continue;
      }
      int pc = (frets[s] + tuning.pitch(s)) % 12;
      pitches[s] = pc;
      counts[pc]++;
      bass = pc;
    }
    int root = pitches[rootString];

    List<Integer> intervals = intervals(counts, root, -1);
    Optional<ChordPattern> match = table.match(intervals.size() + 1, intervals);
    String suffix = "";
    if (match.isEmpty() && bass != root && counts[bass] == 1) {
      List<Integer> withoutBass = intervals(counts, root, bass);
      match = table.match(withoutBass.size() + 1, withoutBass);
      if (match.isPresent()) {
        intervals = withoutBass;
        suffix = "/" + NoteNames.name(bass);
      }
    }

    String name = match.map(ChordPattern::name).orElse(ChordPatternTable.UNKNOWN) + suffix;
    String disclaimer = match.map(ChordPattern::disclaimer).orElse("");
    String spelling = spell(pitches, root, match.orElse(null), twelveToneSpelling);
    ChordAnalysis analysis =
        new ChordAnalysis(
            ctx.staffIndex(),
            ctx.cellIndex(),
            rootString,
            root,
            NoteNames.name(root),
            name,
            disclaimer,
            spelling,
            intervals);
    LOG.debug(
        "Analyzed cell {} of staff {} with root on string {}: {}",
        ctx.cellIndex(),
        ctx.staffIndex(),
        rootString,
        analysis.describe());
    return analysis;
  }

  /** First string at or after {@code start} (mod 6) holding a note, or -1. */
  private static int nextFretted(int[] frets, int start) {
    for (int i = 0; i < StaffGeometry.STRINGS; i++) {
      int s = Math.floorMod(start + i, StaffGeometry.STRINGS);
      if (frets[s] >= 0) {
        return s;
      }
    }
    return -1;
  }

  private static List<Integer> intervals(int[] counts, int root, int excluded) {
    List<Integer> result = new ArrayList<>();
    for (int i = 1; i < 12; i++) {
      int pc = (root + i) % 12;
      if (counts[pc] > 0 && pc != excluded) {
        result.add(i);
      }
    }
    return result;
  }

  private static String spell(
      int[] pitches, int root, ChordPattern pattern, boolean twelveToneSpelling) {
    StringJoiner degrees = new StringJoiner(" ");
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      if (pitches[s] < 0) {
        degrees.add(IntervalNames.NO_NOTE);
      } else {
        int interval = Math.floorMod(pitches[s] - root, 12);
        degrees.add(pattern != null ? pattern.label(interval) : IntervalNames.degree(interval));
      }
    }
    if (!twelveToneSpelling) {
      return degrees.toString();
    }
    StringJoiner numeric = new StringJoiner(" ", " (", ")");
    for (int s = StaffGeometry.STRINGS - 1; s >= 0; s--) {
      numeric.add(
          pitches[s] < 0
              ? IntervalNames.NO_NOTE
              : String.valueOf(Math.floorMod(pitches[s] - root, 12)));
    }
    return degrees + numeric.toString();
  }
}
