package io.fretline.tuning;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between note names and pitch classes.
 *
 * <p>Pitch classes are counted from E, the open low string of a standard-tuned guitar: {@code E=0,
 * F=1, G=3, A=5, B=7, C=8, D=10}. A {@code #} raises a letter by one semitone, a {@code b} lowers
 * it by one. Letters are case-insensitive; case only matters for telling string-lines apart.
 */
public final class NoteNames {

  private static final Pattern NOTE_NAME = Pattern.compile("^([A-Ga-g])([#b]?)$");

  private static final String[] PITCH_NAMES = {
    "E", "F", "F#", "G", "G#", "A", "Bb", "B", "C", "C#", "D", "Eb"
  };

  private NoteNames() {}

  /** Base pitch class of a natural note letter. */
  public static int letterPitch(char letter) {
    return switch (Character.toUpperCase(letter)) {
      case 'E' -> 0;
      case 'F' -> 1;
      case 'G' -> 3;
      case 'A' -> 5;
      case 'B' -> 7;
      case 'C' -> 8;
      case 'D' -> 10;
      default -> throw new IllegalArgumentException("Not a note letter: " + letter);
    };
  }

  /**
   * Pitch class of a letter with an accidental character ({@code '#'}, {@code 'b'}, or anything
   * else for natural), normalized into [0, 12).
   */
  public static int pitchClass(char letter, char accidental) {
    int pitch = letterPitch(letter);
    if (accidental == '#') {
      pitch++;
    } else if (accidental == 'b') {
      pitch--;
    }
    return Math.floorMod(pitch, 12);
  }

  /** Whether {@code name} is a single note letter optionally followed by {@code #} or {@code b}. */
  public static boolean isValidName(String name) {
    return name != null && NOTE_NAME.matcher(name).matches();
  }

  /**
   * Pitch class of a note name such as {@code "F#"} or {@code "Bb"}.
   *
   * @throws IllegalArgumentException if the name is not valid
   */
  public static int parse(String name) {
    Matcher m = name == null ? null : NOTE_NAME.matcher(name);
    if (m == null || !m.matches()) {
      throw new IllegalArgumentException("Invalid note name: " + name);
    }
    char accidental = m.group(2).isEmpty() ? '-' : m.group(2).charAt(0);
    return pitchClass(m.group(1).charAt(0), accidental);
  }

  /** Display name of a pitch class, any integer accepted. */
  public static String name(int pitchClass) {
    return PITCH_NAMES[Math.floorMod(pitchClass, 12)];
  }

  /** String-line prefix for a note name, e.g. {@code "F#"} gives {@code "F#|"}. */
  public static String prefix(String name) {
    if (!isValidName(name)) {
      throw new IllegalArgumentException("Invalid note name: " + name);
    }
    return name.charAt(0) + (name.length() > 1 ? name.substring(1, 2) : "-") + "|";
  }
}
