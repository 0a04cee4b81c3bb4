package com.walstream.client.tls;

import io.grpc.ChannelCredentials;
import io.grpc.TlsChannelCredentials;

/**
 * Secure TLS configuration using system CA certificates.
 *
 * <p>This is the default configuration of {@link
 * com.walstream.client.ClientConfigurationOptions}.
 */
public class SecureTlsConfig extends TlsConfig {

  /**
   * Returns secure TLS credentials using system CA certificates.
   *
   * @return TLS channel credentials with system CAs
   */
  @Override
  public ChannelCredentials toChannelCredentials() {
    return TlsChannelCredentials.create();
  }

  @Override
  public String toString() {
    return "SecureTlsConfig";
  }
}
