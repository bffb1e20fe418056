package io.fretline.chord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the chord pattern table.
 *
 * @param intervals ascending distinct semitone offsets from the root, 1..11; empty matches any
 *     chord with the row's note count
 * @param degreeOverrides spelling labels replacing the default scale-degree label of an interval
 * @param name chord suffix appended to the root name, e.g. {@code "m7"}
 * @param disclaimer omitted-tone note, e.g. {@code ",no5"}
 */
public record ChordPattern(
    List<Integer> intervals, Map<Integer, String> degreeOverrides, String name, String disclaimer) {

  public ChordPattern {
    intervals = List.copyOf(intervals);
    degreeOverrides = Map.copyOf(degreeOverrides);
    int previous = 0;
    for (int interval : intervals) {
      if (interval <= previous || interval > 11) {
        throw new IllegalArgumentException("Intervals must ascend within 1..11: " + intervals);
      }
      previous = interval;
    }
  }

  static ChordPattern of(String name, String disclaimer, Integer... intervals) {
    return new ChordPattern(List.of(intervals), Map.of(), name, disclaimer);
  }

  /** Copy with one more spelling override. */
  ChordPattern spell(int interval, String label) {
    Map<Integer, String> overrides = new HashMap<>(degreeOverrides);
    overrides.put(interval, label);
    return new ChordPattern(intervals, overrides, name, disclaimer);
  }

  /** Number of distinct notes, root included. */
  public int noteCount() {
    return intervals.size() + 1;
  }

  public boolean isWildcard() {
    return intervals.isEmpty();
  }

  public boolean matches(List<Integer> candidate) {
    return isWildcard() || intervals.equals(candidate);
  }

  /** Spelling label of an interval, override first. */
  public String label(int interval) {
    String override = degreeOverrides.get(interval);
    return override != null ? override : IntervalNames.degree(interval);
  }
}
