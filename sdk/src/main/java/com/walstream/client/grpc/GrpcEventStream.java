package com.walstream.client.grpc;

import com.walstream.client.ClientMessage;
import com.walstream.client.ServerMessage;
import com.walstream.client.SessionOpenException;
import com.walstream.client.StreamException;
import com.walstream.client.WalstreamException;
import com.walstream.client.transport.EventStream;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.ForwardingClientCallListener.SimpleForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking {@link EventStream} over an async gRPC bidirectional call.
 *
 * <p>Automatic inbound flow control is disabled. Each {@link #receive()} requests exactly one
 * message from the server and waits for it, so the gRPC callbacks never hold more than one
 * undelivered message plus the terminal signal.
 *
 * <p>A call the server closes before sending response headers, with a status that rejects the
 * call itself ({@code UNIMPLEMENTED}, {@code PERMISSION_DENIED} or {@code UNAUTHENTICATED}), is
 * reported as {@link SessionOpenException}. Every other failure is a {@link StreamException}:
 * servers send headers lazily, so a session can be idle without headers and still fail as an
 * established stream.
 */
class GrpcEventStream implements EventStream {
  private static final Logger logger = LoggerFactory.getLogger(GrpcEventStream.class);
  private static final Set<Status.Code> REJECTION_CODES =
      EnumSet.of(
          Status.Code.UNIMPLEMENTED, Status.Code.PERMISSION_DENIED, Status.Code.UNAUTHENTICATED);

  private final String target;
  private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
  private final Object readyLock = new Object();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ResponseObserver responseObserver = new ResponseObserver();

  private volatile ClientCallStreamObserver<ClientMessage> requestStream;
  private volatile boolean headersReceived = false;
  private volatile WalstreamException terminal;

  GrpcEventStream(String target) {
    this.target = target;
  }

  /** Returns the observer to pass to the stub when starting the call. */
  ClientResponseObserver<ClientMessage, ServerMessage> responseObserver() {
    return responseObserver;
  }

  /** Returns an interceptor that records when the server sends response headers. */
  ClientInterceptor headersInterceptor() {
    return new ClientInterceptor() {
      @Override
      public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
          MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
        return new SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
          @Override
          public void start(Listener<RespT> responseListener, Metadata headers) {
            super.start(
                new SimpleForwardingClientCallListener<RespT>(responseListener) {
                  @Override
                  public void onHeaders(Metadata responseHeaders) {
                    headersReceived = true;
                    super.onHeaders(responseHeaders);
                  }
                },
                headers);
          }
        };
      }
    };
  }

  @Override
  @Nonnull
  public ServerMessage receive() throws StreamException {
    WalstreamException failure = terminal;
    if (failure != null && inbound.isEmpty()) {
      throw failure;
    }
    ClientCallStreamObserver<ClientMessage> stream = requireStarted();
    if (failure == null) {
      stream.request(1);
    }

    Inbound next;
    try {
      next = inbound.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StreamException("Interrupted while waiting for the next event from " + target, e);
    }
    if (next.failure != null) {
      throw next.failure;
    }
    return next.message;
  }

  @Override
  public void send(@Nonnull ClientMessage message) throws StreamException {
    ClientCallStreamObserver<ClientMessage> stream = requireStarted();
    synchronized (readyLock) {
      while (!stream.isReady() && terminal == null) {
        try {
          readyLock.wait();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new StreamException("Interrupted while waiting to send to " + target, e);
        }
      }
    }
    WalstreamException failure = terminal;
    if (failure != null) {
      throw new StreamException("Cannot send, stream is closed: " + failure.getMessage(), failure);
    }
    try {
      stream.onNext(message);
    } catch (RuntimeException e) {
      throw new StreamException("Failed to send to " + target, e);
    }
  }

  @Override
  public void cancel(@Nonnull String reason) {
    fail(new StreamException("Session cancelled: " + reason));
    ClientCallStreamObserver<ClientMessage> stream = requestStream;
    if (stream != null) {
      stream.cancel(reason, null);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    ClientCallStreamObserver<ClientMessage> stream = requestStream;
    if (stream == null) {
      return;
    }
    boolean wasOpen = terminal == null;
    fail(new StreamException("Session closed"));
    if (wasOpen) {
      try {
        stream.onCompleted();
      } catch (RuntimeException e) {
        logger.debug("Half-close failed on stream to {}: {}", target, e.getMessage());
      }
      stream.cancel("Session closed", null);
    }
  }

  private ClientCallStreamObserver<ClientMessage> requireStarted() {
    ClientCallStreamObserver<ClientMessage> stream = requestStream;
    if (stream == null) {
      throw new IllegalStateException("Session call has not been started");
    }
    return stream;
  }

  // First terminal signal wins; later ones are dropped.
  private void fail(WalstreamException failure) {
    synchronized (readyLock) {
      if (terminal != null) {
        return;
      }
      terminal = failure;
      readyLock.notifyAll();
    }
    inbound.offer(Inbound.failure(failure));
  }

  private WalstreamException translate(Throwable t) {
    String description = GrpcErrorHandling.describe(t);
    if (!headersReceived && isRejection(t)) {
      return new SessionOpenException(
          "Session rejected by " + target + " (" + description + ")", t);
    }
    return new StreamException("Session to " + target + " failed (" + description + ")", t);
  }

  private static boolean isRejection(Throwable t) {
    return REJECTION_CODES.contains(Status.fromThrowable(t).getCode());
  }

  private static final class Inbound {
    @Nullable final ServerMessage message;
    @Nullable final WalstreamException failure;

    private Inbound(@Nullable ServerMessage message, @Nullable WalstreamException failure) {
      this.message = message;
      this.failure = failure;
    }

    static Inbound message(ServerMessage message) {
      return new Inbound(message, null);
    }

    static Inbound failure(WalstreamException failure) {
      return new Inbound(null, failure);
    }
  }

  private class ResponseObserver implements ClientResponseObserver<ClientMessage, ServerMessage> {

    @Override
    public void beforeStart(ClientCallStreamObserver<ClientMessage> stream) {
      stream.disableAutoRequestWithInitial(0);
      stream.setOnReadyHandler(
          () -> {
            synchronized (readyLock) {
              readyLock.notifyAll();
            }
          });
      requestStream = stream;
    }

    @Override
    public void onNext(ServerMessage message) {
      headersReceived = true;
      inbound.offer(Inbound.message(message));
    }

    @Override
    public void onError(Throwable t) {
      if (terminal != null) {
        logger.debug("Ignoring error on finished stream to {}: {}", target, t.getMessage());
        return;
      }
      fail(translate(t));
    }

    @Override
    public void onCompleted() {
      logger.debug("Server closed the stream to {}", target);
      fail(StreamException.closedByRemote("Session closed by " + target));
    }
  }
}
