package io.fretline.api;

import java.util.Objects;

/**
 * Recoverable failure of a tablature edit. The operation that throws it has not mutated the
 * document, the tuning or the clipboard.
 */
public class TabEditException extends Exception {
  /** Category of the failure. */
  private final ErrorCode errorCode;

  /** What the operation was looking at when it failed, e.g. the rejected note name. */
  private final String context;

  /**
   * Constructs a new TabEditException without context.
   *
   * @param errorCode the failure category
   * @param message the detail message
   */
  public TabEditException(ErrorCode errorCode, String message) {
    this(errorCode, message, null);
  }

  /**
   * Constructs a new TabEditException with the given context.
   *
   * @param errorCode the failure category
   * @param message the detail message
   * @param context the offending input or location, may be null
   */
  public TabEditException(ErrorCode errorCode, String message, String context) {
    super(formatMessage(message, context, errorCode));
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    this.context = context;
  }

  /**
   * Appends context and error code to the message.
   *
   * @param message the base message
   * @param context the context information
   * @param errorCode the failure category
   * @return the formatted message
   */
  private static String formatMessage(String message, String context, ErrorCode errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode.name()).append("]");
    }
    return sb.toString();
  }

  /**
   * Gets the failure category.
   *
   * @return the error code, never null
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the context information for this exception.
   *
   * @return the context information, or null if none
   */
  public String getContext() {
    return context;
  }
}
