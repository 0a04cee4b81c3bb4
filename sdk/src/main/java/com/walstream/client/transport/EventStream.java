package com.walstream.client.transport;

import com.walstream.client.ClientMessage;
import com.walstream.client.ServerMessage;
import com.walstream.client.SessionOpenException;
import com.walstream.client.StreamException;
import javax.annotation.Nonnull;

/**
 * One open bidirectional session: server messages in, client messages out.
 *
 * <p>Receiving is pull-based. An implementation asks the server for the next message only when
 * {@link #receive()} is called, so at most one received message is ever waiting to be handled.
 *
 * <p>{@link #receive()} and {@link #send(ClientMessage)} are called from a single thread. {@link
 * #cancel(String)} may be called from any thread.
 */
public interface EventStream extends AutoCloseable {

  /**
   * Blocks until the next server message arrives.
   *
   * @return the next message
   * @throws SessionOpenException if the remote rejected the session before accepting it
   * @throws StreamException if the stream failed, was cancelled or was closed by the remote
   */
  @Nonnull
  ServerMessage receive() throws StreamException;

  /**
   * Sends a message to the server, blocking until the transport is ready to accept it.
   *
   * @param message the message to send
   * @throws StreamException if the stream is no longer usable
   */
  void send(@Nonnull ClientMessage message) throws StreamException;

  /**
   * Cancels the stream. A receive or send blocked in another thread fails promptly.
   *
   * @param reason human-readable reason, used in diagnostics
   */
  void cancel(@Nonnull String reason);

  /** Releases the stream. Calling it more than once has no further effect. */
  @Override
  void close();
}
