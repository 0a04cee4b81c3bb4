package com.walstream.client;

/**
 * Thrown when the transport is established but the bidirectional session could not start.
 *
 * <p>This covers a failure to start the call locally as well as a remote that terminated the call
 * before sending response headers.
 */
public class SessionOpenException extends WalstreamException {

  public SessionOpenException(String message) {
    super(message);
  }

  public SessionOpenException(String message, Throwable cause) {
    super(message, cause);
  }
}
