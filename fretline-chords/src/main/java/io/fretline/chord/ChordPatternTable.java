package io.fretline.chord;

import static io.fretline.chord.ChordPattern.of;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered chord patterns, grouped by note count (1 to 6).
 *
 * <p>Rows are scanned in declaration order and the first match wins, so order is part of the
 * table's meaning: a row may shadow a later row with the same intervals.
 *
 * <p>Disclaimers are kept exactly as written, including the {@code "no3"} row that lacks the
 * leading comma the other rows carry.
 */
public final class ChordPatternTable {

  /** Name reported when no row matches. */
  public static final String UNKNOWN = "??";

  private static final ChordPatternTable STANDARD = new ChordPatternTable(standardRows());

  private final List<List<ChordPattern>> byCount;

  /**
   * Builds a table from rows in priority order.
   *
   * @throws IllegalArgumentException if a row has more than six notes
   */
  public ChordPatternTable(List<ChordPattern> rows) {
    List<List<ChordPattern>> grouped = new ArrayList<>();
    for (int i = 0; i <= 6; i++) {
      grouped.add(new ArrayList<>());
    }
    for (ChordPattern row : rows) {
      if (row.noteCount() > 6) {
        throw new IllegalArgumentException("Chord rows hold at most six notes: " + row);
      }
      grouped.get(row.noteCount()).add(row);
    }
    List<List<ChordPattern>> frozen = new ArrayList<>();
    for (List<ChordPattern> group : grouped) {
      frozen.add(Collections.unmodifiableList(group));
    }
    this.byCount = Collections.unmodifiableList(frozen);
  }

  public static ChordPatternTable standard() {
    return STANDARD;
  }

  /** Rows for a note count, in priority order. */
  public List<ChordPattern> rows(int noteCount) {
    if (noteCount < 1 || noteCount > 6) {
      return List.of();
    }
    return byCount.get(noteCount);
  }

  /**
   * Finds the first row for {@code noteCount} whose intervals equal {@code intervals} or that is a
   * wildcard.
   */
  public Optional<ChordPattern> match(int noteCount, List<Integer> intervals) {
    for (ChordPattern row : rows(noteCount)) {
      if (row.matches(intervals)) {
        return Optional.of(row);
      }
    }
    return Optional.empty();
  }

  private static List<ChordPattern> standardRows() {
    return List.of(
        // single note
        of("", ",note"),

        // two notes
        of("5", "", 7),
        of("", ",no5", 4),
        of("m", ",no5", 3),
        of("sus4", ",no5", 5),
        of("sus2", ",no5", 2),
        of("+", ",no3", 8),
        of("(b5)", ",no3", 6),
        of("6", ",no3,no5", 9),
        of("7", ",no3,no5", 10),
        of("maj7", ",no3,no5", 11),

        // three notes
        of("", "", 4, 7),
        of("m", "", 3, 7),
        of("dim", "", 3, 6),
        of("+", "", 4, 8).spell(8, "#5"),
        of("sus4", "", 5, 7),
        of("sus2", "", 2, 7),
        of("7", ",no5", 4, 10),
        of("m7", ",no5", 3, 10),
        of("maj7", ",no5", 4, 11),
        of("m(maj7)", ",no5", 3, 11),
        of("7", "no3", 7, 10),
        of("maj7", ",no3", 7, 11),
        of("6", ",no5", 4, 9),
        of("m6", ",no5", 3, 9),
        of("add9", ",no5", 2, 4).spell(2, "9"),
        of("m(add9)", ",no5", 2, 3).spell(2, "9"),
        of("(b5)", "", 4, 6),
        of("7sus4", ",no5", 5, 10),
        of("9", ",no3,no5", 2, 10).spell(2, "9"),
        of("add11", ",no5", 4, 5).spell(5, "11"),

        // four notes
        of("7", "", 4, 7, 10),
        of("m7", "", 3, 7, 10),
        of("maj7", "", 4, 7, 11),
        of("m(maj7)", "", 3, 7, 11),
        of("m7b5", "", 3, 6, 10),
        of("dim7", "", 3, 6, 9).spell(9, "bb7"),
        of("6", "", 4, 7, 9),
        of("m6", "", 3, 7, 9),
        of("7#5", "", 4, 8, 10).spell(8, "#5"),
        of("7b5", "", 4, 6, 10),
        of("7sus4", "", 5, 7, 10),
        of("add9", "", 2, 4, 7).spell(2, "9"),
        of("m(add9)", "", 2, 3, 7).spell(2, "9"),
        of("add11", "", 4, 5, 7).spell(5, "11"),
        of("9", ",no5", 2, 4, 10).spell(2, "9"),
        of("m9", ",no5", 2, 3, 10).spell(2, "9"),
        of("maj9", ",no5", 2, 4, 11).spell(2, "9"),
        of("7b9", ",no5", 1, 4, 10).spell(1, "b9"),
        of("7#9", ",no5", 3, 4, 10).spell(3, "#9"),
        of("11", ",no5,no9", 4, 5, 10).spell(5, "11"),
        of("13", ",no5,no9", 4, 9, 10).spell(9, "13"),
        of("6/9", ",no5", 2, 4, 9).spell(2, "9"),

        // five notes
        of("9", "", 2, 4, 7, 10).spell(2, "9"),
        of("m9", "", 2, 3, 7, 10).spell(2, "9"),
        of("maj9", "", 2, 4, 7, 11).spell(2, "9"),
        of("6/9", "", 2, 4, 7, 9).spell(2, "9"),
        of("7b9", "", 1, 4, 7, 10).spell(1, "b9"),
        of("7#9", "", 3, 4, 7, 10).spell(3, "#9"),
        // the 11 reading of this shape shadows the 9sus4 row below it
        of("11", ",no3", 2, 5, 7, 10).spell(2, "9").spell(5, "11"),
        of("9sus4", "", 2, 5, 7, 10).spell(2, "9"),
        of("11", ",no9", 4, 5, 7, 10).spell(5, "11"),
        of("m11", ",no9", 3, 5, 7, 10).spell(5, "11"),
        of("13", ",no9", 4, 7, 9, 10).spell(9, "13"),
        of("13", ",no5", 2, 4, 9, 10).spell(2, "9").spell(9, "13"),
        of("7#11", "", 4, 6, 7, 10).spell(6, "#11"),

        // six notes
        of("11", "", 2, 4, 5, 7, 10).spell(2, "9").spell(5, "11"),
        of("m11", "", 2, 3, 5, 7, 10).spell(2, "9").spell(5, "11"),
        of("13", "", 2, 4, 7, 9, 10).spell(2, "9").spell(9, "13"),
        of("maj13", "", 2, 4, 7, 9, 11).spell(2, "9").spell(9, "13"),
        of("9#11", "", 2, 4, 6, 7, 10).spell(2, "9").spell(6, "#11"));
  }
}
