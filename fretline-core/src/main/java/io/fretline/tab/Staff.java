package io.fretline.tab;

/**
 * Location of one six-string staff inside a {@link TabDocument}. String 0 (highest pitch) is the
 * top line, string 5 (lowest) the bottom one.
 *
 * @param index position of the staff among the document's staves
 * @param firstLine document line holding string 0
 */
public record Staff(int index, int firstLine) {

  /** Document line holding the given string. */
  public int line(int stringIndex) {
    if (stringIndex < 0 || stringIndex >= StaffGeometry.STRINGS) {
      throw new IllegalArgumentException("String index out of range: " + stringIndex);
    }
    return firstLine + stringIndex;
  }

  public int lastLine() {
    return firstLine + StaffGeometry.STRINGS - 1;
  }

  public boolean containsLine(int line) {
    return line >= firstLine && line <= lastLine();
  }
}
