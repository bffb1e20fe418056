package io.fretline.tab;

import java.util.Objects;

/**
 * One 3-character tablature slot on one string-line.
 *
 * <p>Recognized forms:
 *
 * <ul>
 *   <li>{@code "---"} blank
 *   <li>{@code "--|"} barline
 *   <li>{@code "<emb><d><d>"} or {@code "<emb>-<d>"} note, where {@code <emb>} is one of {@code
 *       -hpbr/\~(X}
 * </ul>
 *
 * Anything else a user typed into a cell is kept verbatim as {@link Text}.
 */
public sealed interface Cell permits Cell.Blank, Cell.Barline, Cell.Note, Cell.Text {

  int WIDTH = 3;
  int MAX_FRET = 24;

  Blank BLANK = new Blank();
  Barline BARLINE = new Barline();

  /** The exact three characters written into a string-line for this cell. */
  String render();

  /** Empty cell. */
  record Blank() implements Cell {
    @Override
    public String render() {
      return "---";
    }
  }

  /** Bar separator; always present on all six strings of a staff at once. */
  record Barline() implements Cell {
    @Override
    public String render() {
      return "--|";
    }
  }

  /** Fretted note with its embellishment. */
  record Note(EmbKind embellishment, int fret) implements Cell {
    public Note {
      Objects.requireNonNull(embellishment, "embellishment");
      if (fret < 0 || fret > MAX_FRET) {
        throw new IllegalArgumentException("Fret out of range 0.." + MAX_FRET + ": " + fret);
      }
    }

    public Note withFret(int newFret) {
      return new Note(embellishment, newFret);
    }

    public Note withEmbellishment(EmbKind kind) {
      return new Note(kind, fret);
    }

    @Override
    public String render() {
      return fret < 10 ? embellishment.symbol() + "-" + fret : embellishment.symbol() + "" + fret;
    }
  }

  /** Unrecognized cell content, preserved as typed. */
  record Text(String raw) implements Cell {
    @Override
    public String render() {
      return raw;
    }
  }

  /**
   * Parses the three characters of a cell. Short input (a line cut mid-cell) is padded with
   * dashes.
   */
  static Cell parse(CharSequence raw) {
    String s = raw.toString();
    if (s.length() < WIDTH) {
      s = s + "-".repeat(WIDTH - s.length());
    } else if (s.length() > WIDTH) {
      s = s.substring(0, WIDTH);
    }
    if (s.equals("---")) {
      return BLANK;
    }
    if (s.equals("--|")) {
      return BARLINE;
    }
    EmbKind emb = EmbKind.fromSymbol(s.charAt(0));
    char tens = s.charAt(1);
    char ones = s.charAt(2);
    if (emb != null && isDigit(ones)) {
      if (tens == '-') {
        return new Note(emb, ones - '0');
      }
      if (isDigit(tens)) {
        int fret = (tens - '0') * 10 + (ones - '0');
        if (fret <= MAX_FRET) {
          return new Note(emb, fret);
        }
      }
    }
    return new Text(s);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
