package com.walstream.client;

/**
 * Base exception class for all walstream client errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Every failure of a single
 * connection attempt is reported through one of its subclasses:
 *
 * <ul>
 *   <li>{@link DialException} - the transport to the CDC service could not be established
 *   <li>{@link SessionOpenException} - the transport is up but the streaming session was rejected
 *   <li>{@link StreamException} - an active session failed or was closed by the remote
 * </ul>
 *
 * <p>None of them is fatal. The {@link ConnectionManager} logs the failure and reconnects after
 * the delay chosen by its {@link com.walstream.client.retry.RetryPolicy}.
 */
public class WalstreamException extends RuntimeException {

  /**
   * Constructs a new WalstreamException with the specified detail message.
   *
   * @param message the detail message
   */
  public WalstreamException(String message) {
    super(message);
  }

  /**
   * Constructs a new WalstreamException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public WalstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
