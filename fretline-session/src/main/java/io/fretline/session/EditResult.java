package io.fretline.session;

/**
 * Buffer and cursor handed back to the host after a command.
 *
 * @param text full buffer content
 * @param cursor raw cursor offset into {@code text}
 * @param action what the command did
 */
public record EditResult(String text, int cursor, Action action) {}
