package com.walstream.client.event;

import javax.annotation.Nonnull;

/**
 * Receives every recognized change event of a session, in receipt order.
 *
 * <p>The event is acknowledged to the server only after this method returns. The next event is not
 * requested until then either, so a slow consumer slows the server down. Implementations should
 * return quickly.
 *
 * <p>An exception thrown from {@link #accept(ChangeEvent)} ends the session without acknowledging
 * the event. The client then reconnects.
 */
@FunctionalInterface
public interface ChangeEventConsumer {

  /**
   * Handles one change event.
   *
   * @param event the event, never null
   */
  void accept(@Nonnull ChangeEvent event);
}
