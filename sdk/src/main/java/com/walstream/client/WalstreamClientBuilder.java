package com.walstream.client;

import com.walstream.client.event.ChangeEventConsumer;
import com.walstream.client.grpc.GrpcChannelFactory;
import com.walstream.client.grpc.GrpcTransport;
import com.walstream.client.transport.Transport;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Builder for creating {@link WalstreamClient} instances with custom configuration.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * WalstreamClient client = WalstreamClient.builder(consumer)
 *     .options(options)
 *     .build();
 * }</pre>
 *
 * @see WalstreamClient#builder(ChangeEventConsumer)
 */
public final class WalstreamClientBuilder {
  private final ChangeEventConsumer consumer;
  private ClientConfigurationOptions options = ClientConfigurationOptions.getDefault();
  private Optional<GrpcChannelFactory> channelFactory = Optional.empty();
  private Optional<Transport> transport = Optional.empty();

  WalstreamClientBuilder(@Nonnull ChangeEventConsumer consumer) {
    this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
  }

  /**
   * Sets the client options. Defaults to {@link ClientConfigurationOptions#getDefault()}.
   *
   * @param options the options to use
   * @return this builder for method chaining
   */
  @Nonnull
  public WalstreamClientBuilder options(@Nonnull ClientConfigurationOptions options) {
    this.options = Objects.requireNonNull(options, "options cannot be null");
    return this;
  }

  /**
   * Sets a custom channel factory for the gRPC transport.
   *
   * <p>This is primarily used for testing.
   *
   * @param channelFactory the channel factory to use
   * @return this builder for method chaining
   */
  @Nonnull
  public WalstreamClientBuilder channelFactory(@Nonnull GrpcChannelFactory channelFactory) {
    this.channelFactory =
        Optional.of(Objects.requireNonNull(channelFactory, "channelFactory cannot be null"));
    return this;
  }

  /**
   * Replaces the gRPC transport. When set, {@link #channelFactory(GrpcChannelFactory)} is
   * ignored.
   *
   * @param transport the transport to use
   * @return this builder for method chaining
   */
  @Nonnull
  public WalstreamClientBuilder transport(@Nonnull Transport transport) {
    this.transport = Optional.of(Objects.requireNonNull(transport, "transport cannot be null"));
    return this;
  }

  /**
   * Builds the WalstreamClient instance.
   *
   * @return a new, not yet started client
   */
  @Nonnull
  public WalstreamClient build() {
    Transport resolved =
        transport.orElseGet(
            () -> new GrpcTransport(options, channelFactory.orElseGet(GrpcChannelFactory::new)));
    return new WalstreamClient(options, resolved, consumer);
  }
}
