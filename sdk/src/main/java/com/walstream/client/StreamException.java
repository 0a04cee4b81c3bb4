package com.walstream.client;

import java.util.OptionalLong;
import javax.annotation.Nullable;

/**
 * Thrown when an active session fails.
 *
 * <p>Receive failures, acknowledgment send failures, consumer failures and an orderly closure
 * initiated by the remote all end the session with this exception. {@link #isClosedByRemote()}
 * tells the orderly closure apart from the rest.
 */
public class StreamException extends WalstreamException {

  @Nullable private final Long lastAcknowledgedPosition;
  private final boolean closedByRemote;

  public StreamException(String message) {
    this(message, null, null, false);
  }

  public StreamException(String message, Throwable cause) {
    this(message, cause, null, false);
  }

  /**
   * Constructs a new StreamException.
   *
   * @param message the detail message
   * @param cause the cause of the exception, may be null
   * @param lastAcknowledgedPosition the last log position acknowledged on the failed session, or
   *     null if nothing was acknowledged
   * @param closedByRemote whether the remote ended the stream in an orderly way
   */
  public StreamException(
      String message,
      @Nullable Throwable cause,
      @Nullable Long lastAcknowledgedPosition,
      boolean closedByRemote) {
    super(message, cause);
    this.lastAcknowledgedPosition = lastAcknowledgedPosition;
    this.closedByRemote = closedByRemote;
  }

  /**
   * Creates the exception reported when the remote completes the stream.
   *
   * @param message the detail message
   * @return a new exception with {@link #isClosedByRemote()} set
   */
  public static StreamException closedByRemote(String message) {
    return new StreamException(message, null, null, true);
  }

  /**
   * Returns the last log position acknowledged before the session failed.
   *
   * @return the position, or empty if the session acknowledged nothing or it is not known
   */
  public OptionalLong getLastAcknowledgedPosition() {
    return lastAcknowledgedPosition == null
        ? OptionalLong.empty()
        : OptionalLong.of(lastAcknowledgedPosition);
  }

  /** Returns whether the remote ended the stream in an orderly way. */
  public boolean isClosedByRemote() {
    return closedByRemote;
  }
}
