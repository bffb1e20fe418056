package io.fretline.tab;

/** Embellishment of a note, stored as the character preceding the fret digits of a cell. */
public enum EmbKind {
  NORMAL('-'),
  HAMMER('h'),
  PULL('p'),
  BEND('b'),
  RELEASE('r'),
  SLIDE_UP('/'),
  SLIDE_DOWN('\\'),
  VIBRATO('~'),
  GHOST('('),
  MUFFLED('X');

  private final char symbol;

  EmbKind(char symbol) {
    this.symbol = symbol;
  }

  public char symbol() {
    return symbol;
  }

  /**
   * Looks up the embellishment written as {@code c}.
   *
   * @return the embellishment, or null if {@code c} is not an embellishment character
   */
  public static EmbKind fromSymbol(char c) {
    for (EmbKind kind : values()) {
      if (kind.symbol == c) {
        return kind;
      }
    }
    return null;
  }

  /** Toggle rule: applying the current embellishment again restores {@link #NORMAL}. */
  public EmbKind toggle(EmbKind applied) {
    return this == applied ? NORMAL : applied;
  }
}
