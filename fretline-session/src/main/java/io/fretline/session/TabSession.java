package io.fretline.session;

import io.fretline.api.ErrorCode;
import io.fretline.api.TabEditException;
import io.fretline.chord.ChordAnalysis;
import io.fretline.chord.ChordAnalyzer;
import io.fretline.chord.ChordLabeler;
import io.fretline.chord.ChordPatternTable;
import io.fretline.config.TabConfig;
import io.fretline.config.TabConfig.EntryMode;
import io.fretline.tab.Cell;
import io.fretline.tab.CellRange;
import io.fretline.tab.CursorModel;
import io.fretline.tab.Direction;
import io.fretline.tab.EmbKind;
import io.fretline.tab.RectangleClip;
import io.fretline.tab.StaffEditor;
import io.fretline.tab.TabContext;
import io.fretline.tab.TabDocument;
import io.fretline.tab.TextPosition;
import io.fretline.tuning.Transposer;
import io.fretline.tuning.Tuning;
import io.fretline.tuning.TuningModel;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-document editing state: the buffer, cursor and mark, the active tuning, the single-slot
 * rectangle clipboard, the pending embellishment and the last chord analysis. One session exists
 * per open document; commands run one at a time.
 *
 * <p>Every operation takes an already resolved {@link TabContext}. Operations either complete or
 * throw {@link TabEditException} before changing anything.
 */
public final class TabSession {

  private static final Logger LOG = LoggerFactory.getLogger(TabSession.class);

  private final TabConfig config;
  private final TabDocument document;
  private final CursorModel cursorModel;
  private final StaffEditor editor;
  private final TuningModel tuning;
  private final Transposer transposer;
  private final ChordAnalyzer chordAnalyzer;
  private final ChordLabeler chordLabeler;

  private TextPosition cursor = new TextPosition(0, 0);
  private TextPosition mark;
  private RectangleClip clipboard;
  private EmbKind pendingEmbellishment = EmbKind.NORMAL;
  private EntryMode mode;
  private ChordAnalysis pendingAnalysis;

  public TabSession(TabDocument document, TabConfig config) {
    this.document = Objects.requireNonNull(document, "document");
    this.config = Objects.requireNonNull(config, "config");
    this.cursorModel = new CursorModel(document);
    this.editor = new StaffEditor(document, cursorModel);
    this.tuning = new TuningModel(document, config.tuning());
    this.transposer = new Transposer(document, tuning);
    this.chordAnalyzer = new ChordAnalyzer(document, ChordPatternTable.standard());
    this.chordLabeler = new ChordLabeler(document);
    this.mode = config.mode();
  }

  /** Opens a session on host text with the cursor at a raw offset. */
  public static TabSession open(String text, int cursorOffset, TabConfig config) {
    TabSession session = new TabSession(TabDocument.fromText(text), config);
    session.setCursorOffset(cursorOffset);
    return session;
  }

  // ---- host-facing state ----

  public TabDocument document() {
    return document;
  }

  public TabConfig config() {
    return config;
  }

  public String text() {
    return document.toText();
  }

  public TextPosition cursor() {
    return cursor;
  }

  public int cursorOffset() {
    return document.offsetOf(cursor);
  }

  public void setCursor(TextPosition pos) {
    Objects.requireNonNull(pos, "pos");
    if (!pos.equals(cursor)) {
      pendingAnalysis = null;
    }
    int line = Math.min(pos.line(), document.lineCount() - 1);
    cursor = new TextPosition(line, pos.column());
  }

  public void setCursorOffset(int offset) {
    setCursor(document.positionAt(offset));
  }

  /**
   * Brings the session in line with the host's buffer and cursor. Chord analysis state survives
   * only if neither changed.
   */
  public void sync(String text, int cursorOffset) {
    if (!document.toText().equals(text)) {
      document.replaceText(text);
      pendingAnalysis = null;
    }
    setCursorOffset(cursorOffset);
  }

  public Optional<TextPosition> mark() {
    return Optional.ofNullable(mark);
  }

  public void setMark(TextPosition pos) {
    mark = pos;
    pendingAnalysis = null;
  }

  public Optional<RectangleClip> clipboard() {
    return Optional.ofNullable(clipboard);
  }

  public Tuning tuning() {
    return tuning.current();
  }

  public EmbKind pendingEmbellishment() {
    return pendingEmbellishment;
  }

  public EntryMode mode() {
    return mode;
  }

  public EntryMode toggleMode() {
    pendingAnalysis = null;
    mode = mode == EntryMode.LEAD ? EntryMode.CHORD : EntryMode.LEAD;
    LOG.debug("Entry mode now {}", mode);
    return mode;
  }

  /** The cursor resolved against the document; empty when not in tab. */
  public Optional<TabContext> context() {
    return cursorModel.resolve(cursor);
  }

  /** Inserts host input as plain text at the cursor. */
  public void insertLiteral(String text) {
    pendingAnalysis = null;
    if (text == null || text.isEmpty()) {
      return;
    }
    cursor = document.insertText(cursor, text);
  }

  // ---- staves ----

  public TabContext makeStaff() {
    pendingAnalysis = null;
    TabContext ctx = editor.makeStaff(cursor, config.staffWidth(), tuning.current().prefixes());
    cursor = ctx.position();
    return ctx;
  }

  // ---- notes ----

  /**
   * Writes a note on {@code stringIndex} in the cursor's column, carrying the pending
   * embellishment.
   *
   * @throws TabEditException with {@link ErrorCode#INVALID_FRET} if the fret is outside 0 to the
   *     configured maximum
   */
  public void placeNote(TabContext ctx, int stringIndex, int fret) throws TabEditException {
    pendingAnalysis = null;
    if (fret < 0 || fret > config.maxEntryFret()) {
      throw new TabEditException(
          ErrorCode.INVALID_FRET,
          "Fret must be within 0.." + config.maxEntryFret(),
          String.valueOf(fret));
    }
    editor.writeCell(ctx, stringIndex, new Cell.Note(pendingEmbellishment, fret));
    pendingEmbellishment = EmbKind.NORMAL;
    if (mode == EntryMode.CHORD) {
      cursor = ctx.withString(stringIndex).position();
    } else if (cursorModel.hasNextCell(ctx)) {
      cursor = cursorModel.advance(ctx, 1).position();
    } else {
      cursor = ctx.position();
    }
  }

  public void deleteNote(TabContext ctx) {
    pendingAnalysis = null;
    editor.clearCell(ctx);
    cursor = ctx.position();
  }

  /**
   * Toggles an embellishment on the note under the cursor, or on the pending embellishment when
   * there is no note.
   *
   * @return the embellishment now in effect
   */
  public EmbKind embellish(TabContext ctx, EmbKind kind) {
    pendingAnalysis = null;
    Cell cell = document.cell(ctx.staff(), ctx.stringIndex(), ctx.cellIndex());
    if (cell instanceof Cell.Note note) {
      EmbKind next = note.embellishment().toggle(kind);
      editor.writeCell(ctx, ctx.stringIndex(), note.withEmbellishment(next));
      return next;
    }
    pendingEmbellishment = pendingEmbellishment.toggle(kind);
    return pendingEmbellishment;
  }

  // ---- navigation ----

  public TabContext moveCells(TabContext ctx, int delta) {
    return moveTo(cursorModel.advance(ctx, delta));
  }

  public TabContext moveStrings(TabContext ctx, int delta) {
    return moveTo(cursorModel.moveStrings(ctx, delta));
  }

  /** Moves to the next or previous staff; leaves the cursor alone if there is none. */
  public Optional<TabContext> moveStaff(TabContext ctx, Direction direction) {
    Optional<TabContext> target = cursorModel.moveStaff(ctx, direction);
    target.ifPresent(this::moveTo);
    return target;
  }

  public Optional<TabContext> moveToBarline(TabContext ctx, Direction direction) {
    Optional<TabContext> target = cursorModel.findBarline(ctx, direction);
    target.ifPresent(this::moveTo);
    return target;
  }

  /** Moves to the last cell of the string-line going forward, the first going backward. */
  public TabContext moveToLineEdge(TabContext ctx, Direction direction) {
    return moveTo(
        direction == Direction.FORWARD ? cursorModel.lineEnd(ctx) : cursorModel.lineStart(ctx));
  }

  private TabContext moveTo(TabContext ctx) {
    setCursor(ctx.position());
    return ctx;
  }

  // ---- columns ----

  public void insertColumns(TabContext ctx, int count) {
    pendingAnalysis = null;
    editor.insertColumns(ctx, count);
    cursor = ctx.position();
  }

  public void deleteCells(TabContext ctx, int count, Direction direction) {
    pendingAnalysis = null;
    cursor = editor.deleteCells(ctx, count, direction).position();
  }

  /**
   * Toggles the barline column under the cursor.
   *
   * @return whether the column changed; a column holding notes is left alone
   */
  public boolean toggleBarline(TabContext ctx, boolean advanceCursor) {
    pendingAnalysis = null;
    Optional<TextPosition> next = editor.toggleBarline(ctx, advanceCursor);
    next.ifPresent(pos -> cursor = pos);
    return next.isPresent();
  }

  // ---- regions ----

  /**
   * Copies the rectangle between mark and cursor into the clipboard, replacing what it held, and
   * removes it from the staff when {@code deleteSource} is set.
   *
   * @throws TabEditException with {@link ErrorCode#NO_REGION} without a mark, or {@link
   *     ErrorCode#REGION_SPANS_MULTIPLE_STAVES} if mark and cursor are not in one staff
   */
  public RectangleClip killRegion(TabContext ctx, boolean deleteSource) throws TabEditException {
    pendingAnalysis = null;
    CellRange range = region(ctx);
    clipboard = editor.kill(range, deleteSource);
    if (deleteSource) {
      cursor = TabContext.of(range.staff(), ctx.stringIndex(), range.firstCell()).position();
    }
    return clipboard;
  }

  /**
   * Inserts the clipboard rectangle at the cursor.
   *
   * @throws TabEditException with {@link ErrorCode#EMPTY_CLIPBOARD} if nothing was killed yet
   */
  public void yank(TabContext ctx) throws TabEditException {
    pendingAnalysis = null;
    if (clipboard == null) {
      throw new TabEditException(ErrorCode.EMPTY_CLIPBOARD, "Nothing to yank");
    }
    editor.yank(ctx, clipboard);
    cursor = ctx.position();
  }

  /**
   * Transposes the region between mark and cursor, or the cursor's column when no mark is set.
   *
   * @return number of notes changed
   */
  public int transpose(TabContext ctx, int semitones) throws TabEditException {
    pendingAnalysis = null;
    CellRange range = mark == null ? CellRange.column(ctx) : region(ctx);
    return transposer.transpose(range, semitones);
  }

  private CellRange region(TabContext ctx) throws TabEditException {
    if (mark == null) {
      throw new TabEditException(ErrorCode.NO_REGION, "The mark is not set");
    }
    Optional<TabContext> begin = cursorModel.resolve(mark);
    if (begin.isEmpty()) {
      throw new TabEditException(
          ErrorCode.REGION_SPANS_MULTIPLE_STAVES,
          "Region must lie within a single staff",
          "mark " + mark + " is not in tab");
    }
    return CellRange.between(begin.get(), ctx);
  }

  // ---- frets and tuning ----

  public boolean octaveShift(TabContext ctx, Transposer.Octave octave) {
    pendingAnalysis = null;
    return transposer.octaveShift(ctx, octave);
  }

  public Tuning learnTuning(TabContext ctx) {
    pendingAnalysis = null;
    return tuning.learn(ctx.staff());
  }

  public Tuning retuneString(TabContext ctx, String newNoteName) throws TabEditException {
    pendingAnalysis = null;
    return tuning.retuneString(ctx, newNoteName);
  }

  public TabContext copyRetune(TabContext ctx) {
    pendingAnalysis = null;
    return moveTo(transposer.copyRetune(ctx));
  }

  // ---- chords ----

  /**
   * Names the chord in the cursor's column. Called again with nothing in between, it moves the
   * root to the next fretted string.
   */
  public ChordAnalysis analyzeChord(TabContext ctx) throws TabEditException {
    ChordAnalysis previous = pendingAnalysis;
    if (previous != null
        && (previous.staffIndex() != ctx.staffIndex() || previous.cellIndex() != ctx.cellIndex())) {
      previous = null;
    }
    pendingAnalysis = null;
    ChordAnalysis analysis =
        chordAnalyzer.analyze(ctx, tuning.current(), previous, config.twelveToneSpelling());
    pendingAnalysis = analysis;
    return analysis;
  }

  /**
   * Writes the name from the analysis that immediately preceded this call above its column.
   *
   * @throws TabEditException with {@link ErrorCode#CHORD_LABEL_OUT_OF_SEQUENCE} if the previous
   *     operation was not a successful chord analysis
   */
  public ChordAnalysis labelChord(TabContext ctx) throws TabEditException {
    ChordAnalysis analysis = pendingAnalysis;
    if (analysis == null || analysis.staffIndex() != ctx.staffIndex()) {
      throw new TabEditException(
          ErrorCode.CHORD_LABEL_OUT_OF_SEQUENCE,
          "Label a chord right after analyzing it");
    }
    pendingAnalysis = null;
    int inserted = chordLabeler.label(ctx.staff(), analysis);
    if (inserted > 0) {
      cursor = new TextPosition(cursor.line() + inserted, cursor.column());
    }
    return analysis;
  }
}
