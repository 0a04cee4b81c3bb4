package com.walstream.client.tls;

import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;

/**
 * Plaintext configuration without any transport security.
 *
 * <p>Only use this for a CDC service reachable on loopback or inside a trusted network. Change
 * payloads contain table rows and travel unencrypted.
 */
public class InsecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return InsecureChannelCredentials.create();
  }

  @Override
  public boolean isSecure() {
    return false;
  }

  @Override
  public String toString() {
    return "InsecureTlsConfig";
  }
}
