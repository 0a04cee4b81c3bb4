package com.walstream.client.grpc;

import com.walstream.client.ClientConfigurationOptions;
import com.walstream.client.PluginServiceGrpc;
import io.grpc.Channel;
import io.grpc.ChannelCredentials;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import java.util.concurrent.TimeUnit;

/**
 * Factory for gRPC channels and stubs to the CDC service.
 *
 * <p>Unlike a shared channel pool, every connection attempt gets its own channel. The channel is
 * owned by the {@link GrpcConnection} created for the attempt and shut down with it, so no
 * transport state survives a failed session.
 */
public class GrpcChannelFactory {

  /**
   * Creates a new channel for the configured endpoint.
   *
   * <p>The channel is configured for a long-lived stream: keep-alive pings are sent even while no
   * call is active, so a silently dropped connection is detected.
   *
   * @param options the client configuration
   * @return a new, not yet connected channel
   */
  public ManagedChannel createChannel(ClientConfigurationOptions options) {
    ChannelCredentials credentials = options.tlsConfig().toChannelCredentials();

    return Grpc.newChannelBuilder(options.target(), credentials)
        .keepAliveTime(options.keepAliveTimeMs(), TimeUnit.MILLISECONDS)
        .keepAliveTimeout(options.keepAliveTimeoutMs(), TimeUnit.MILLISECONDS)
        .keepAliveWithoutCalls(true)
        .maxInboundMessageSize(options.maxInboundMessageSizeBytes())
        .build();
  }

  /**
   * Creates an async stub on the given channel.
   *
   * @param channel the channel to call through
   * @param interceptor interceptor applied to every call of the stub
   * @return the stub
   */
  public PluginServiceGrpc.PluginServiceStub createStub(
      Channel channel, ClientInterceptor interceptor) {
    return PluginServiceGrpc.newStub(ClientInterceptors.intercept(channel, interceptor));
  }
}
