package io.fretline.session;

import io.fretline.api.TabEditException;
import io.fretline.chord.ChordAnalysis;
import io.fretline.tab.Direction;
import io.fretline.tab.EmbKind;
import io.fretline.tab.RectangleClip;
import io.fretline.tab.TabContext;
import io.fretline.tuning.Transposer;
import io.fretline.tuning.Tuning;
import java.util.Optional;

/**
 * Editor command bound to a host event. Tab-aware commands only run when the cursor resolves to a
 * tab context; otherwise the {@link CommandDispatcher} inserts the triggering input literally.
 */
public sealed interface TabCommand {

  /**
   * Runs the command.
   *
   * @param session the document's session
   * @param context resolved cursor; always present when {@link #requiresTab()} is true
   * @return what the command did
   * @throws TabEditException if the command cannot apply; nothing has changed in that case
   */
  Action execute(TabSession session, Optional<TabContext> context) throws TabEditException;

  /** Whether the command degrades to literal insertion outside tab. */
  default boolean requiresTab() {
    return true;
  }

  record MakeStaff() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      TabContext ctx = session.makeStaff();
      return new Action.Applied("staff " + ctx.staffIndex() + " created");
    }

    @Override
    public boolean requiresTab() {
      return false;
    }
  }

  record PlaceNote(int stringIndex, int fret) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      session.placeNote(context.orElseThrow(), stringIndex, fret);
      return new Action.Applied("fret " + fret + " on string " + stringIndex);
    }
  }

  record DeleteNote() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      session.deleteNote(context.orElseThrow());
      return new Action.Applied("note deleted");
    }
  }

  record Embellish(EmbKind kind) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      EmbKind now = session.embellish(context.orElseThrow(), kind);
      return new Action.Applied("embellishment " + now);
    }
  }

  record MoveCells(int delta) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      TabContext ctx = session.moveCells(context.orElseThrow(), delta);
      return new Action.Applied("cell " + ctx.cellIndex());
    }
  }

  record MoveStrings(int delta) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      TabContext ctx = session.moveStrings(context.orElseThrow(), delta);
      return new Action.Applied("string " + ctx.stringIndex());
    }
  }

  record MoveStaff(Direction direction) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      return session
          .moveStaff(context.orElseThrow(), direction)
          .<Action>map(ctx -> new Action.Applied("staff " + ctx.staffIndex()))
          .orElseGet(() -> new Action.Report("No staff " + direction.name().toLowerCase()));
    }
  }

  record MoveToBarline(Direction direction) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      return session
          .moveToBarline(context.orElseThrow(), direction)
          .<Action>map(ctx -> new Action.Applied("cell " + ctx.cellIndex()))
          .orElseGet(() -> new Action.Report("No barline " + direction.name().toLowerCase()));
    }
  }

  record MoveToLineEdge(Direction direction) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      TabContext ctx = session.moveToLineEdge(context.orElseThrow(), direction);
      return new Action.Applied("cell " + ctx.cellIndex());
    }
  }

  record InsertColumns(int count) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      session.insertColumns(context.orElseThrow(), count);
      return new Action.Applied(count + " column(s) inserted");
    }
  }

  record DeleteCells(int count, Direction direction) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      session.deleteCells(context.orElseThrow(), count, direction);
      return new Action.Applied(count + " cell(s) deleted");
    }
  }

  record ToggleBarline(boolean advanceCursor) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      if (!session.toggleBarline(context.orElseThrow(), advanceCursor)) {
        return new Action.Report("Column holds notes");
      }
      return new Action.Applied("barline toggled");
    }
  }

  record SetMark() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      session.setMark(session.cursor());
      return new Action.Applied("mark set");
    }

    @Override
    public boolean requiresTab() {
      return false;
    }
  }

  record KillRegion(boolean deleteSource) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      RectangleClip clip = session.killRegion(context.orElseThrow(), deleteSource);
      return new Action.Applied(
          (deleteSource ? "killed " : "copied ") + clip.width() + " column(s)");
    }
  }

  record Yank() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      session.yank(context.orElseThrow());
      return new Action.Applied("yanked");
    }
  }

  record Transpose(int semitones) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      int changed = session.transpose(context.orElseThrow(), semitones);
      return new Action.Applied(changed + " note(s) transposed");
    }
  }

  record OctaveShift(Transposer.Octave octave) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      boolean changed = session.octaveShift(context.orElseThrow(), octave);
      return new Action.Applied(changed ? "octave " + octave : "unchanged");
    }
  }

  record LearnTuning() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      Tuning tuning = session.learnTuning(context.orElseThrow());
      return new Action.Report("Tuning: " + tuning);
    }
  }

  record RetuneString(String noteName) implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      Tuning tuning = session.retuneString(context.orElseThrow(), noteName);
      return new Action.Report("Tuning: " + tuning);
    }
  }

  record CopyRetune() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      TabContext ctx = session.copyRetune(context.orElseThrow());
      return new Action.Applied("retuned copy at staff " + ctx.staffIndex());
    }
  }

  record AnalyzeChord() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      ChordAnalysis analysis = session.analyzeChord(context.orElseThrow());
      return new Action.Report(analysis.describe());
    }
  }

  record LabelChord() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context)
        throws TabEditException {
      ChordAnalysis analysis = session.labelChord(context.orElseThrow());
      return new Action.Applied("labelled " + analysis.chordName());
    }
  }

  record ToggleMode() implements TabCommand {
    @Override
    public Action execute(TabSession session, Optional<TabContext> context) {
      return new Action.Report("Mode: " + session.toggleMode());
    }

    @Override
    public boolean requiresTab() {
      return false;
    }
  }
}
