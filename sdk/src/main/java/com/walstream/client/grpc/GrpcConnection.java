package com.walstream.client.grpc;

import com.walstream.client.PluginServiceGrpc;
import com.walstream.client.SessionOpenException;
import com.walstream.client.transport.Connection;
import com.walstream.client.transport.EventStream;
import io.grpc.ManagedChannel;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A connected gRPC channel owned by one connection attempt. */
class GrpcConnection implements Connection {
  private static final Logger logger = LoggerFactory.getLogger(GrpcConnection.class);
  private static final long TERMINATION_TIMEOUT_MS = 5000;

  private final ManagedChannel channel;
  private final String target;
  private final GrpcChannelFactory channelFactory;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  GrpcConnection(ManagedChannel channel, String target, GrpcChannelFactory channelFactory) {
    this.channel = channel;
    this.target = target;
    this.channelFactory = channelFactory;
  }

  @Override
  @Nonnull
  public EventStream openSession() throws SessionOpenException {
    if (closed.get()) {
      throw new SessionOpenException("Connection to " + target + " is closed");
    }
    GrpcEventStream stream = new GrpcEventStream(target);
    try {
      PluginServiceGrpc.PluginServiceStub stub =
          channelFactory.createStub(channel, stream.headersInterceptor());
      stub.session(stream.responseObserver());
    } catch (RuntimeException e) {
      stream.close();
      throw new SessionOpenException(
          "Failed to start session on " + target + ": " + GrpcErrorHandling.describe(e), e);
    }
    return stream;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.debug("Shutting down channel to {}", target);
    shutdown(channel);
  }

  static void shutdown(ManagedChannel channel) {
    channel.shutdownNow();
    try {
      if (!channel.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        logger.warn("Channel did not terminate within {}ms", TERMINATION_TIMEOUT_MS);
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for channel termination");
      Thread.currentThread().interrupt();
    }
  }
}
