package com.walstream.client.grpc;

import com.walstream.client.ClientConfigurationOptions;
import com.walstream.client.DialException;
import com.walstream.client.transport.Connection;
import com.walstream.client.transport.Transport;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} that dials the CDC service over gRPC.
 *
 * <p>gRPC channels connect lazily. To report an unreachable endpoint as a {@link DialException}
 * instead of a failed call, {@link #dial()} forces the channel to connect and waits until it is
 * {@code READY}. A channel that reaches {@code TRANSIENT_FAILURE} or does not become ready within
 * the connect timeout is shut down and the dial fails. The wait also ends, with a failed dial,
 * once the cancellation token completes.
 */
public class GrpcTransport implements Transport {
  private static final Logger logger = LoggerFactory.getLogger(GrpcTransport.class);
  private static final long CANCELLATION_CHECK_INTERVAL_MS = 50;

  private final ClientConfigurationOptions options;
  private final GrpcChannelFactory channelFactory;

  public GrpcTransport(@Nonnull ClientConfigurationOptions options) {
    this(options, new GrpcChannelFactory());
  }

  public GrpcTransport(
      @Nonnull ClientConfigurationOptions options, @Nonnull GrpcChannelFactory channelFactory) {
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory cannot be null");
  }

  @Override
  @Nonnull
  public Connection dial(@Nonnull CompletableFuture<Void> cancellationToken)
      throws DialException {
    String target = options.target();
    logger.debug("Dialing {} ({})", target, options.tlsConfig());

    ManagedChannel channel;
    try {
      channel = channelFactory.createChannel(options);
    } catch (RuntimeException e) {
      throw new DialException("Failed to create channel to " + target, e);
    }

    try {
      awaitReady(channel, target, options.connectTimeoutMs(), cancellationToken);
    } catch (DialException e) {
      GrpcConnection.shutdown(channel);
      throw e;
    }
    return new GrpcConnection(channel, target, channelFactory);
  }

  private static void awaitReady(
      ManagedChannel channel,
      String target,
      long timeoutMs,
      CompletableFuture<Void> cancellationToken) {
    CompletableFuture<ConnectivityState> settled = new CompletableFuture<>();
    watch(channel, channel.getState(true), settled);

    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    ConnectivityState state;
    while (true) {
      if (cancellationToken.isDone()) {
        throw new DialException("Dial to " + target + " cancelled");
      }
      long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      try {
        state =
            settled.get(
                Math.max(1, Math.min(remainingMs, CANCELLATION_CHECK_INTERVAL_MS)),
                TimeUnit.MILLISECONDS);
        break;
      } catch (TimeoutException e) {
        if (deadline - System.nanoTime() <= 0) {
          throw new DialException(
              "Timed out after " + timeoutMs + "ms connecting to " + target, e);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DialException("Interrupted while connecting to " + target, e);
      } catch (ExecutionException e) {
        throw new DialException("Failed to connect to " + target, e.getCause());
      }
    }
    if (state != ConnectivityState.READY) {
      throw new DialException("Failed to connect to " + target + ": channel is " + state);
    }
  }

  // Follows state changes until the channel settles on READY, TRANSIENT_FAILURE or SHUTDOWN.
  private static void watch(
      ManagedChannel channel,
      ConnectivityState current,
      CompletableFuture<ConnectivityState> settled) {
    if (settled.isDone()) {
      return;
    }
    switch (current) {
      case READY:
      case TRANSIENT_FAILURE:
      case SHUTDOWN:
        settled.complete(current);
        return;
      case IDLE:
      case CONNECTING:
      default:
        channel.notifyWhenStateChanged(
            current,
            () -> {
              ConnectivityState next = channel.getState(false);
              if (next == ConnectivityState.IDLE) {
                next = channel.getState(true);
              }
              watch(channel, next, settled);
            });
    }
  }
}
