package com.walstream.client.transport;

import com.walstream.client.SessionOpenException;
import javax.annotation.Nonnull;

/** An established transport connection to the CDC service. */
public interface Connection extends AutoCloseable {

  /**
   * Opens a bidirectional streaming session on this connection.
   *
   * @return the open session stream
   * @throws SessionOpenException if the session cannot be started
   */
  @Nonnull
  EventStream openSession() throws SessionOpenException;

  /** Releases the connection. Calling it more than once has no further effect. */
  @Override
  void close();
}
