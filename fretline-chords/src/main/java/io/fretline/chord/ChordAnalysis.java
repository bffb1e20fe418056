package io.fretline.chord;

import java.util.List;

/**
 * Result of naming the chord in one staff column.
 *
 * @param staffIndex staff holding the chord
 * @param cellIndex column of the chord
 * @param rootString string whose note was taken as the root
 * @param rootPitch pitch class of the root
 * @param rootName display name of the root
 * @param name resolved suffix, e.g. {@code "m7"}, {@code "/F#"} appended for slash chords, or
 *     {@link ChordPatternTable#UNKNOWN}
 * @param disclaimer omitted-tone note, e.g. {@code ",no5"}; empty if none
 * @param spelling per-string degree labels, high string first
 * @param intervals ascending distinct non-root intervals that were matched
 */
public record ChordAnalysis(
    int staffIndex,
    int cellIndex,
    int rootString,
    int rootPitch,
    String rootName,
    String name,
    String disclaimer,
    String spelling,
    List<Integer> intervals) {

  public ChordAnalysis {
    intervals = List.copyOf(intervals);
  }

  /** Root name followed by the resolved suffix, e.g. {@code "Am7"}. */
  public String chordName() {
    return rootName + name;
  }

  public boolean isRecognized() {
    return !name.startsWith(ChordPatternTable.UNKNOWN);
  }

  /** One-line report: name, disclaimer and spelling. */
  public String describe() {
    return chordName() + disclaimer + "  " + spelling;
  }
}
