package io.fretline.session;

/** What a dispatched command did, reported back to the host. */
public sealed interface Action permits Action.InsertLiteral, Action.Applied, Action.Report {

  /** The cursor was not in tab, so the triggering input was inserted as plain text. */
  record InsertLiteral(String text) implements Action {}

  /** The command edited the document or moved the cursor. */
  record Applied(String summary) implements Action {}

  /** The command produced a message for the user, e.g. a chord name. */
  record Report(String message) implements Action {}
}
