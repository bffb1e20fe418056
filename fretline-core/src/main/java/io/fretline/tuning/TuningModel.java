package io.fretline.tuning;

import io.fretline.api.ErrorCode;
import io.fretline.api.TabEditException;
import io.fretline.tab.Staff;
import io.fretline.tab.StaffGeometry;
import io.fretline.tab.TabContext;
import io.fretline.tab.TabDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active tuning of a session and the operations that change it: learning it from a
 * staff's prefixes and relabelling one string across the whole document.
 */
public final class TuningModel {

  private static final Logger LOG = LoggerFactory.getLogger(TuningModel.class);

  private final TabDocument document;
  private Tuning current;

  public TuningModel(TabDocument document, Tuning initial) {
    this.document = Objects.requireNonNull(document, "document");
    this.current = Objects.requireNonNull(initial, "initial");
  }

  public Tuning current() {
    return current;
  }

  /**
   * Reads the tuning declared by a staff's six prefixes without changing the active tuning.
   * Letters map through {@link NoteNames#pitchClass}; the second prefix character is the
   * accidental.
   */
  public Tuning read(Staff staff) {
    List<Integer> pitches = new ArrayList<>(StaffGeometry.STRINGS);
    List<String> prefixes = new ArrayList<>(StaffGeometry.STRINGS);
    for (int s = 0; s < StaffGeometry.STRINGS; s++) {
      String line = document.line(staff.line(s));
      pitches.add(NoteNames.pitchClass(line.charAt(0), line.charAt(1)));
      prefixes.add(line.substring(0, StaffGeometry.PREFIX_WIDTH));
    }
    return new Tuning(pitches, prefixes);
  }

  /** Replaces the active tuning with the one declared by {@code staff}. */
  public Tuning learn(Staff staff) {
    current = read(staff);
    LOG.debug("Learned tuning {} from staff {}", current, staff.index());
    return current;
  }

  /**
   * Renames one string in every staff of the document, then re-learns the tuning from the context's
   * staff.
   *
   * <p>The new prefix keeps the letter case given when that keeps the string's first character
   * unique in every staff, otherwise the other case is tried.
   *
   * @throws TabEditException with {@link ErrorCode#INVALID_TUNING_NAME} if {@code newNoteName} is
   *     not a note letter with an optional accidental, or if neither letter case is unique; nothing
   *     is relabelled in that case
   */
  public Tuning retuneString(TabContext ctx, String newNoteName) throws TabEditException {
    if (!NoteNames.isValidName(newNoteName)) {
      throw new TabEditException(
          ErrorCode.INVALID_TUNING_NAME,
          "Tuning name must be a note letter optionally followed by # or b",
          "'" + newNoteName + "'");
    }
    List<Staff> staves = List.copyOf(document.staves());
    String prefix = NoteNames.prefix(newNoteName);
    if (!uniqueInAllStaves(staves, ctx.stringIndex(), prefix.charAt(0))) {
      prefix = swapCase(prefix.charAt(0)) + prefix.substring(1);
      if (!uniqueInAllStaves(staves, ctx.stringIndex(), prefix.charAt(0))) {
        throw new TabEditException(
            ErrorCode.INVALID_TUNING_NAME,
            "Another string already uses that letter in both cases",
            "'" + newNoteName + "'");
      }
    }
    for (Staff staff : staves) {
      int lineIndex = staff.line(ctx.stringIndex());
      String line = document.line(lineIndex);
      document.setLine(lineIndex, prefix + line.substring(StaffGeometry.PREFIX_WIDTH));
    }
    LOG.debug(
        "Relabelled string {} as '{}' in {} staves", ctx.stringIndex(), prefix, staves.size());
    return learn(ctx.staff());
  }

  private boolean uniqueInAllStaves(List<Staff> staves, int stringIndex, char first) {
    for (Staff staff : staves) {
      for (int s = 0; s < StaffGeometry.STRINGS; s++) {
        if (s != stringIndex && document.line(staff.line(s)).charAt(0) == first) {
          return false;
        }
      }
    }
    return true;
  }

  private static char swapCase(char c) {
    return Character.isUpperCase(c) ? Character.toLowerCase(c) : Character.toUpperCase(c);
  }
}
