package com.walstream.client;

import com.walstream.client.retry.FixedDelayRetryPolicy;
import com.walstream.client.retry.RetryPolicy;
import com.walstream.client.tls.SecureTlsConfig;
import com.walstream.client.tls.TlsConfig;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Configuration options for the walstream client.
 *
 * <p>This class holds the endpoint of the CDC service, transport settings, the reconnect policy
 * and the policy for messages of unknown variant.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * ClientConfigurationOptions options = ClientConfigurationOptions.builder()
 *     .setHost("127.0.0.1")
 *     .setPort(50051)
 *     .setTlsConfig(new InsecureTlsConfig())
 *     .setRetryPolicy(new FixedDelayRetryPolicy(Duration.ofSeconds(2)))
 *     .build();
 * }</pre>
 */
public class ClientConfigurationOptions {

  /** Default host of the CDC service: the loopback address. */
  public static final String DEFAULT_HOST = "127.0.0.1";

  /** Default port of the CDC service. */
  public static final int DEFAULT_PORT = 50051;

  /** Default max inbound message size: 16MB. */
  public static final int DEFAULT_MAX_INBOUND_MESSAGE_SIZE_BYTES = 16 * 1024 * 1024;

  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private TlsConfig tlsConfig = new SecureTlsConfig();
  private int connectTimeoutMs = 15000;
  private int keepAliveTimeMs = 10000;
  private int keepAliveTimeoutMs = 10000;
  private int maxInboundMessageSizeBytes = DEFAULT_MAX_INBOUND_MESSAGE_SIZE_BYTES;
  private RetryPolicy retryPolicy = new FixedDelayRetryPolicy();
  private UnrecognizedEventPolicy unrecognizedEventPolicy = UnrecognizedEventPolicy.SKIP;

  private ClientConfigurationOptions() {}

  private ClientConfigurationOptions(
      String host,
      int port,
      TlsConfig tlsConfig,
      int connectTimeoutMs,
      int keepAliveTimeMs,
      int keepAliveTimeoutMs,
      int maxInboundMessageSizeBytes,
      RetryPolicy retryPolicy,
      UnrecognizedEventPolicy unrecognizedEventPolicy) {
    this.host = host;
    this.port = port;
    this.tlsConfig = tlsConfig;
    this.connectTimeoutMs = connectTimeoutMs;
    this.keepAliveTimeMs = keepAliveTimeMs;
    this.keepAliveTimeoutMs = keepAliveTimeoutMs;
    this.maxInboundMessageSizeBytes = maxInboundMessageSizeBytes;
    this.retryPolicy = retryPolicy;
    this.unrecognizedEventPolicy = unrecognizedEventPolicy;
  }

  /**
   * Returns the host of the CDC service.
   *
   * @return the host name or address
   */
  public String host() {
    return this.host;
  }

  /**
   * Returns the port of the CDC service.
   *
   * @return the port
   */
  public int port() {
    return this.port;
  }

  /** Returns {@code host:port}, with IPv6 literals in brackets. */
  public String target() {
    if (this.host.indexOf(':') >= 0 && !this.host.startsWith("[")) {
      return "[" + this.host + "]:" + this.port;
    }
    return this.host + ":" + this.port;
  }

  /**
   * Returns the transport security configuration.
   *
   * <p>Defaults to {@link SecureTlsConfig}. Plaintext must be configured explicitly.
   *
   * @return the TLS configuration
   */
  public TlsConfig tlsConfig() {
    return this.tlsConfig;
  }

  /**
   * Returns how long a dial waits for the channel to become ready.
   *
   * <p>A dial that neither succeeds nor fails within this time is reported as a {@link
   * DialException}.
   *
   * @return the connect timeout in milliseconds
   */
  public int connectTimeoutMs() {
    return this.connectTimeoutMs;
  }

  /**
   * Returns the interval between HTTP/2 keep-alive pings.
   *
   * <p>Keep-alive is also sent while no call is active, so a dead server is noticed even when the
   * stream is idle.
   *
   * @return the keep-alive time in milliseconds
   */
  public int keepAliveTimeMs() {
    return this.keepAliveTimeMs;
  }

  /**
   * Returns how long to wait for a keep-alive ping acknowledgment before closing the transport.
   *
   * @return the keep-alive timeout in milliseconds
   */
  public int keepAliveTimeoutMs() {
    return this.keepAliveTimeoutMs;
  }

  /**
   * Returns the maximum size of a single message received from the server.
   *
   * @return the maximum inbound message size in bytes
   */
  public int maxInboundMessageSizeBytes() {
    return this.maxInboundMessageSizeBytes;
  }

  /**
   * Returns the policy that paces reconnect attempts.
   *
   * <p>Defaults to a fixed delay of 2 seconds.
   *
   * @return the retry policy
   */
  public RetryPolicy retryPolicy() {
    return this.retryPolicy;
  }

  /**
   * Returns how messages of an unknown variant are handled.
   *
   * @return the unrecognized event policy, {@link UnrecognizedEventPolicy#SKIP} by default
   */
  public UnrecognizedEventPolicy unrecognizedEventPolicy() {
    return this.unrecognizedEventPolicy;
  }

  /**
   * Returns the default client configuration options.
   *
   * <p>Default values: host 127.0.0.1, port 50051, secure TLS, connectTimeoutMs 15000,
   * keepAliveTimeMs 10000, keepAliveTimeoutMs 10000, maxInboundMessageSizeBytes 16MB, fixed 2
   * second retry delay, unrecognized events skipped.
   *
   * @return the default client configuration options
   */
  public static ClientConfigurationOptions getDefault() {
    return new ClientConfigurationOptions();
  }

  /**
   * Returns a new builder for creating ClientConfigurationOptions.
   *
   * @return a new ClientConfigurationOptionsBuilder
   */
  public static ClientConfigurationOptionsBuilder builder() {
    return new ClientConfigurationOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public ClientConfigurationOptionsBuilder toBuilder() {
    return new ClientConfigurationOptionsBuilder()
        .setHost(this.host)
        .setPort(this.port)
        .setTlsConfig(this.tlsConfig)
        .setConnectTimeoutMs(this.connectTimeoutMs)
        .setKeepAliveTimeMs(this.keepAliveTimeMs)
        .setKeepAliveTimeoutMs(this.keepAliveTimeoutMs)
        .setMaxInboundMessageSizeBytes(this.maxInboundMessageSizeBytes)
        .setRetryPolicy(this.retryPolicy)
        .setUnrecognizedEventPolicy(this.unrecognizedEventPolicy);
  }

  @Override
  public String toString() {
    return "ClientConfigurationOptions{target="
        + target()
        + ", tls="
        + tlsConfig
        + ", connectTimeoutMs="
        + connectTimeoutMs
        + ", retryPolicy="
        + retryPolicy
        + ", unrecognizedEventPolicy="
        + unrecognizedEventPolicy
        + "}";
  }

  /**
   * Builder for creating ClientConfigurationOptions instances.
   *
   * <p>All parameters have defaults if not specified. Setters validate their argument and throw
   * {@link IllegalArgumentException} for out-of-range values.
   *
   * @see ClientConfigurationOptions
   */
  public static class ClientConfigurationOptionsBuilder {
    private ClientConfigurationOptions defaultOptions = ClientConfigurationOptions.getDefault();

    private String host = defaultOptions.host();
    private int port = defaultOptions.port();
    private TlsConfig tlsConfig = defaultOptions.tlsConfig();
    private int connectTimeoutMs = defaultOptions.connectTimeoutMs();
    private int keepAliveTimeMs = defaultOptions.keepAliveTimeMs();
    private int keepAliveTimeoutMs = defaultOptions.keepAliveTimeoutMs();
    private int maxInboundMessageSizeBytes = defaultOptions.maxInboundMessageSizeBytes();
    private RetryPolicy retryPolicy = defaultOptions.retryPolicy();
    private UnrecognizedEventPolicy unrecognizedEventPolicy =
        defaultOptions.unrecognizedEventPolicy();

    private ClientConfigurationOptionsBuilder() {}

    /**
     * Sets the host of the CDC service.
     *
     * @param host the host name or address
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setHost(@Nonnull String host) {
      Objects.requireNonNull(host, "host cannot be null");
      if (host.trim().isEmpty()) {
        throw new IllegalArgumentException("host cannot be empty");
      }
      this.host = host;
      return this;
    }

    /**
     * Sets the port of the CDC service.
     *
     * @param port the port, between 1 and 65535
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setPort(int port) {
      if (port < 1 || port > 65535) {
        throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
      }
      this.port = port;
      return this;
    }

    /**
     * Sets the transport security configuration.
     *
     * @param tlsConfig the TLS configuration
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setTlsConfig(@Nonnull TlsConfig tlsConfig) {
      this.tlsConfig = Objects.requireNonNull(tlsConfig, "tlsConfig cannot be null");
      return this;
    }

    /**
     * Sets how long a dial waits for the channel to become ready.
     *
     * @param connectTimeoutMs the connect timeout in milliseconds, must be positive
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setConnectTimeoutMs(int connectTimeoutMs) {
      if (connectTimeoutMs <= 0) {
        throw new IllegalArgumentException("connectTimeoutMs must be positive");
      }
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    /**
     * Sets the interval between keep-alive pings.
     *
     * @param keepAliveTimeMs the keep-alive time in milliseconds, must be positive
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setKeepAliveTimeMs(int keepAliveTimeMs) {
      if (keepAliveTimeMs <= 0) {
        throw new IllegalArgumentException("keepAliveTimeMs must be positive");
      }
      this.keepAliveTimeMs = keepAliveTimeMs;
      return this;
    }

    /**
     * Sets how long to wait for a keep-alive acknowledgment.
     *
     * @param keepAliveTimeoutMs the keep-alive timeout in milliseconds, must be positive
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setKeepAliveTimeoutMs(int keepAliveTimeoutMs) {
      if (keepAliveTimeoutMs <= 0) {
        throw new IllegalArgumentException("keepAliveTimeoutMs must be positive");
      }
      this.keepAliveTimeoutMs = keepAliveTimeoutMs;
      return this;
    }

    /**
     * Sets the maximum size of a single message received from the server.
     *
     * @param maxInboundMessageSizeBytes the limit in bytes, must be positive
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setMaxInboundMessageSizeBytes(
        int maxInboundMessageSizeBytes) {
      if (maxInboundMessageSizeBytes <= 0) {
        throw new IllegalArgumentException("maxInboundMessageSizeBytes must be positive");
      }
      this.maxInboundMessageSizeBytes = maxInboundMessageSizeBytes;
      return this;
    }

    /**
     * Sets the policy that paces reconnect attempts.
     *
     * @param retryPolicy the retry policy
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setRetryPolicy(@Nonnull RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
      return this;
    }

    /**
     * Sets how messages of an unknown variant are handled.
     *
     * @param unrecognizedEventPolicy the policy
     * @return this builder for method chaining
     */
    public ClientConfigurationOptionsBuilder setUnrecognizedEventPolicy(
        @Nonnull UnrecognizedEventPolicy unrecognizedEventPolicy) {
      this.unrecognizedEventPolicy =
          Objects.requireNonNull(
              unrecognizedEventPolicy, "unrecognizedEventPolicy cannot be null");
      return this;
    }

    /**
     * Builds a new ClientConfigurationOptions instance.
     *
     * @return a new ClientConfigurationOptions with the configured settings
     */
    public ClientConfigurationOptions build() {
      return new ClientConfigurationOptions(
          this.host,
          this.port,
          this.tlsConfig,
          this.connectTimeoutMs,
          this.keepAliveTimeMs,
          this.keepAliveTimeoutMs,
          this.maxInboundMessageSizeBytes,
          this.retryPolicy,
          this.unrecognizedEventPolicy);
    }
  }
}
