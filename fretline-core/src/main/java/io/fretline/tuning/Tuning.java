package io.fretline.tuning;

import io.fretline.tab.StaffGeometry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Open-string pitch classes and string-line prefixes, index-aligned with string order (0 is the
 * highest string).
 *
 * @param pitches six pitch classes in [0, 12)
 * @param prefixes six 3-character prefixes with pairwise distinct first characters
 */
public record Tuning(List<Integer> pitches, List<String> prefixes) {

  public Tuning {
    pitches = List.copyOf(pitches);
    prefixes = List.copyOf(prefixes);
    if (pitches.size() != StaffGeometry.STRINGS || prefixes.size() != StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("A tuning has exactly six strings");
    }
    Set<Character> firsts = new HashSet<>();
    for (int i = 0; i < StaffGeometry.STRINGS; i++) {
      int p = pitches.get(i);
      if (p < 0 || p >= 12) {
        throw new IllegalArgumentException("Pitch class out of range: " + p);
      }
      String prefix = prefixes.get(i);
      if (prefix.length() != StaffGeometry.PREFIX_WIDTH) {
        throw new IllegalArgumentException("Prefix must be 3 characters: '" + prefix + "'");
      }
      if (!firsts.add(prefix.charAt(0))) {
        throw new IllegalArgumentException("Duplicate string prefix: '" + prefix + "'");
      }
    }
  }

  /** Standard guitar tuning {@code e B G D A E}. */
  public static Tuning standard() {
    return fromNames(List.of("e", "B", "G", "D", "A", "E"));
  }

  /**
   * Builds a tuning from six note names, high string first, e.g. {@code [e, B, G, D, A, E]}.
   *
   * @throws IllegalArgumentException if a name is invalid or two names share a first character
   */
  public static Tuning fromNames(List<String> names) {
    if (names.size() != StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("Need six note names, got " + names.size());
    }
    List<Integer> pitches = new ArrayList<>();
    List<String> prefixes = new ArrayList<>();
    for (String name : names) {
      pitches.add(NoteNames.parse(name));
      prefixes.add(NoteNames.prefix(name));
    }
    return new Tuning(pitches, prefixes);
  }

  public int pitch(int stringIndex) {
    return pitches.get(stringIndex);
  }

  public String prefix(int stringIndex) {
    return prefixes.get(stringIndex);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (String prefix : prefixes) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(prefix, 0, prefix.charAt(1) == '-' ? 1 : 2);
    }
    return sb.toString();
  }
}
