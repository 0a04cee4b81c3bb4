package com.walstream.client.event;

import com.walstream.client.ServerMessage;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Converts wire messages into {@link ChangeEvent}s. */
public final class ChangeEvents {

  private ChangeEvents() {}

  /**
   * Converts a server message into a change event.
   *
   * @param message the message received on the session
   * @return the event, or empty when the message carries no variant this client recognizes
   */
  @Nonnull
  public static Optional<ChangeEvent> fromServerMessage(@Nonnull ServerMessage message) {
    switch (message.getMsgCase()) {
      case INSERT:
        return Optional.of(ChangeEvent.fromInsert(message.getInsert()));
      case UPDATE:
        return Optional.of(ChangeEvent.fromUpdate(message.getUpdate()));
      case DELETE:
        return Optional.of(ChangeEvent.fromDelete(message.getDelete()));
      case TRUNCATE:
        return Optional.of(ChangeEvent.fromTruncate(message.getTruncate()));
      case MSG_NOT_SET:
      default:
        return Optional.empty();
    }
  }
}
