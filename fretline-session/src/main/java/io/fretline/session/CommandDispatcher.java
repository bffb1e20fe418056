package io.fretline.session;

import io.fretline.api.TabEditException;
import io.fretline.tab.TabContext;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes host events to {@link TabCommand}s. The cursor is resolved once per event; a tab-aware
 * command issued outside tab becomes a literal insertion of the key that triggered it.
 */
public final class CommandDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

  private final TabSession session;

  public CommandDispatcher(TabSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  public TabSession session() {
    return session;
  }

  /**
   * Runs {@code command} at the session's cursor.
   *
   * @param rawInput the key or text that triggered the command, inserted verbatim if the cursor is
   *     not in tab
   * @throws TabEditException if the command fails; the buffer is unchanged
   */
  public EditResult dispatch(TabCommand command, String rawInput) throws TabEditException {
    Objects.requireNonNull(command, "command");
    Optional<TabContext> context = session.context();
    Action action;
    if (command.requiresTab() && context.isEmpty()) {
      LOG.debug("Not in tab at {}, inserting '{}' for {}", session.cursor(), rawInput, command);
      session.insertLiteral(rawInput);
      action = new Action.InsertLiteral(rawInput == null ? "" : rawInput);
    } else {
      try {
        action = command.execute(session, context);
      } catch (TabEditException e) {
        LOG.debug("{} failed: {}", command, e.getMessage());
        throw e;
      }
      LOG.trace("{} -> {}", command, action);
    }
    return new EditResult(session.text(), session.cursorOffset(), action);
  }

  /** Syncs the session with the host's buffer and cursor, then dispatches. */
  public EditResult dispatch(String buffer, int cursorOffset, TabCommand command, String rawInput)
      throws TabEditException {
    session.sync(buffer, cursorOffset);
    return dispatch(command, rawInput);
  }
}
