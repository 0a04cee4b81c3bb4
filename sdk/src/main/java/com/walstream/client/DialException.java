package com.walstream.client;

/**
 * Thrown when the transport connection to the CDC service cannot be established.
 *
 * <p>Typical causes are a refused or unreachable endpoint, a TLS handshake failure or a connect
 * timeout. No retry happens inside the attempt that raised it.
 */
public class DialException extends WalstreamException {

  public DialException(String message) {
    super(message);
  }

  public DialException(String message, Throwable cause) {
    super(message, cause);
  }
}
