package io.fretline.chord;

/** Default scale-degree labels of the twelve intervals above a root. */
public final class IntervalNames {

  private static final String[] DEGREES = {
    "rt", "b2", "2", "b3", "3", "4", "b5", "5", "b6", "6", "7", "maj7"
  };

  /** Label of a string with no note. */
  public static final String NO_NOTE = "x";

  private IntervalNames() {}

  public static String degree(int interval) {
    return DEGREES[Math.floorMod(interval, 12)];
  }
}
