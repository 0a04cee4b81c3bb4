package com.walstream.client.tls;

import io.grpc.ChannelCredentials;

/**
 * Abstract base class for transport security strategies.
 *
 * <p>Implementations define how the gRPC channel to the CDC service is secured. The client uses
 * {@link SecureTlsConfig} unless told otherwise. Plaintext has to be requested explicitly with
 * {@link InsecureTlsConfig}, which is meant for a server listening on loopback.
 *
 * <p>Example of a custom certificate authority:
 *
 * <pre>{@code
 * public class CustomCaTlsConfig extends TlsConfig {
 *     private final File caCertFile;
 *
 *     public CustomCaTlsConfig(File caCertFile) {
 *         this.caCertFile = caCertFile;
 *     }
 *
 *     @Override
 *     public ChannelCredentials toChannelCredentials() {
 *         try {
 *             return TlsChannelCredentials.newBuilder()
 *                 .trustManager(caCertFile)
 *                 .build();
 *         } catch (IOException e) {
 *             throw new UncheckedIOException("Failed to load CA certificate", e);
 *         }
 *     }
 * }
 * }</pre>
 */
public abstract class TlsConfig {

  /**
   * Converts this configuration to gRPC ChannelCredentials.
   *
   * @return Channel credentials for the connection
   */
  public abstract ChannelCredentials toChannelCredentials();

  /**
   * Returns whether traffic is encrypted with this configuration.
   *
   * @return true unless the configuration is plaintext
   */
  public boolean isSecure() {
    return true;
  }
}
