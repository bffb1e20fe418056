package io.fretline.api;

/** Machine-readable reason attached to every {@link TabEditException}. */
public enum ErrorCode {
  /** A kill, copy or transpose region has endpoints in two different staves. */
  REGION_SPANS_MULTIPLE_STAVES,
  /** A retune name is not a single note letter with an optional accidental. */
  INVALID_TUNING_NAME,
  /** The root search wrapped through all six strings without finding a fretted note. */
  NO_NOTES_IN_CHORD,
  /** A chord label was requested without an immediately preceding analysis. */
  CHORD_LABEL_OUT_OF_SEQUENCE,
  /** Yank was requested before anything was killed or copied. */
  EMPTY_CLIPBOARD,
  /** A region operation was requested with no mark set. */
  NO_REGION,
  /** Note entry outside the configured fret range. */
  INVALID_FRET
}
