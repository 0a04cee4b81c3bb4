package com.walstream.client.grpc;

import static com.walstream.client.TestMessages.insert;
import static com.walstream.client.TestMessages.truncate;
import static com.walstream.client.TestMessages.update;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.walstream.client.ClientConfigurationOptions;
import com.walstream.client.ClientMessage;
import com.walstream.client.DialException;
import com.walstream.client.PluginServiceGrpc;
import com.walstream.client.ScriptedTransport;
import com.walstream.client.ServerMessage;
import com.walstream.client.SessionOpenException;
import com.walstream.client.SessionState;
import com.walstream.client.StreamException;
import com.walstream.client.UnrecognizedEventPolicy;
import com.walstream.client.event.ChangeEvent;
import com.walstream.client.session.SessionHandler;
import com.walstream.client.tls.InsecureTlsConfig;
import io.grpc.BindableService;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for the gRPC transport against an in-process CDC service. */
public class GrpcTransportTest {

  private static final ClientConfigurationOptions OPTIONS =
      ClientConfigurationOptions.builder()
          .setTlsConfig(new InsecureTlsConfig())
          .setConnectTimeoutMs(2000)
          .build();

  private Server server;
  private String serverName;
  private List<ChangeEvent> received;
  private CompletableFuture<Void> cancellationToken;

  @BeforeEach
  public void setUp() {
    serverName = InProcessServerBuilder.generateName();
    received = Collections.synchronizedList(new ArrayList<>());
    cancellationToken = new CompletableFuture<>();
  }

  @AfterEach
  public void tearDown() throws Exception {
    if (server != null) {
      server.shutdownNow();
      server.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  private void startServer(BindableService service) throws Exception {
    server =
        InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(service)
            .build()
            .start();
  }

  private GrpcTransport transport(String name) {
    return new GrpcTransport(
        OPTIONS,
        new GrpcChannelFactory() {
          @Override
          public ManagedChannel createChannel(ClientConfigurationOptions options) {
            return InProcessChannelBuilder.forName(name).build();
          }
        });
  }

  private SessionHandler handler() {
    return new SessionHandler(
        transport(serverName), received::add, UnrecognizedEventPolicy.SKIP, cancellationToken);
  }

  @Test
  public void testDialFailsWhenServerIsUnreachable() {
    GrpcTransport transport = transport("no-such-server");

    assertThrows(DialException.class, () -> transport.dial(cancellationToken));
  }

  @Test
  public void testShutdownStopsDialInProgress() throws Exception {
    ManagedChannel channel = mock(ManagedChannel.class);
    when(channel.getState(anyBoolean())).thenReturn(ConnectivityState.CONNECTING);
    GrpcTransport transport =
        new GrpcTransport(
            ClientConfigurationOptions.builder()
                .setTlsConfig(new InsecureTlsConfig())
                .setConnectTimeoutMs(60_000)
                .build(),
            new GrpcChannelFactory() {
              @Override
              public ManagedChannel createChannel(ClientConfigurationOptions options) {
                return channel;
              }
            });
    SessionHandler handler =
        new SessionHandler(
            transport, received::add, UnrecognizedEventPolicy.SKIP, cancellationToken);

    CompletableFuture<Void> serving = CompletableFuture.runAsync(handler::connectAndServe);
    assertTrue(
        ScriptedTransport.awaitCondition(() -> handler.getState() == SessionState.DIALING, 2000));

    long start = System.nanoTime();
    cancellationToken.complete(null);
    serving.get(5, TimeUnit.SECONDS);

    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5000);
    assertEquals(SessionState.CANCELLED, handler.getState());
    verify(channel).shutdownNow();
  }

  @Test
  public void testSessionAcknowledgesEveryEvent() throws Exception {
    ScriptedCdcService service =
        new ScriptedCdcService(
            Arrays.asList(
                insert("public", "users", "{\"id\":1}", 100),
                update("public", "users", "{\"id\":1}", 150),
                truncate("public", "users", 200)),
            null,
            false,
            null);
    startServer(service);

    SessionHandler handler = handler();
    StreamException e = assertThrows(StreamException.class, handler::connectAndServe);

    assertTrue(e.isClosedByRemote());
    assertEquals(200, e.getLastAcknowledgedPosition().getAsLong());
    assertEquals(SessionState.CLOSED_BY_REMOTE, handler.getState());
    assertEquals(Arrays.asList(100L, 150L, 200L), service.getAcknowledgedPositions());
    assertEquals(3, received.size());
    assertFalse(received.get(2).getPayload().isPresent());
  }

  @Test
  public void testRejectedSessionIsSessionOpenError() throws Exception {
    startServer(
        new ScriptedCdcService(
            Collections.emptyList(), null, false, Status.PERMISSION_DENIED.withDescription("no")));

    SessionHandler handler = handler();
    SessionOpenException e = assertThrows(SessionOpenException.class, handler::connectAndServe);

    assertTrue(e.getMessage().contains("PERMISSION_DENIED"));
    assertEquals(SessionState.CLOSED_BY_ERROR, handler.getState());
    assertTrue(received.isEmpty());
  }

  @Test
  public void testUnimplementedServiceIsSessionOpenError() throws Exception {
    startServer(new PluginServiceGrpc.PluginServiceImplBase() {});

    assertThrows(SessionOpenException.class, handler()::connectAndServe);
  }

  @Test
  public void testServerErrorAfterEventsIsStreamError() throws Exception {
    ScriptedCdcService service =
        new ScriptedCdcService(
            Collections.singletonList(insert("public", "users", "{}", 100)),
            Status.UNAVAILABLE.withDescription("replication slot dropped"),
            false,
            null);
    startServer(service);

    SessionHandler handler = handler();
    StreamException e = assertThrows(StreamException.class, handler::connectAndServe);

    assertFalse(e.isClosedByRemote());
    assertTrue(e.getMessage().contains("UNAVAILABLE"));
    assertEquals(100, e.getLastAcknowledgedPosition().getAsLong());
    assertEquals(Collections.singletonList(100L), service.getAcknowledgedPositions());
  }

  @Test
  public void testIdleSessionFailingBeforeFirstEventIsStreamError() throws Exception {
    IdleCdcService service = new IdleCdcService();
    startServer(service);
    SessionHandler handler = handler();

    CompletableFuture<Void> serving = CompletableFuture.runAsync(handler::connectAndServe);
    StreamObserver<ServerMessage> responseObserver = service.call.get(2, TimeUnit.SECONDS);
    assertTrue(
        ScriptedTransport.awaitCondition(() -> handler.getState() == SessionState.ACTIVE, 2000));

    responseObserver.onError(
        Status.UNAVAILABLE.withDescription("replication slot dropped").asRuntimeException());

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> serving.get(5, TimeUnit.SECONDS));
    assertTrue(e.getCause() instanceof StreamException);
    StreamException failure = (StreamException) e.getCause();
    assertFalse(failure.isClosedByRemote());
    assertFalse(failure.getLastAcknowledgedPosition().isPresent());
    assertTrue(failure.getMessage().contains("UNAVAILABLE"));
    assertEquals(SessionState.CLOSED_BY_ERROR, handler.getState());
  }

  @Test
  public void testCancelActiveSession() throws Exception {
    ScriptedCdcService service =
        new ScriptedCdcService(
            Collections.singletonList(insert("public", "users", "{}", 100)), null, true, null);
    startServer(service);
    SessionHandler handler = handler();

    CompletableFuture<Void> serving = CompletableFuture.runAsync(handler::connectAndServe);
    assertTrue(
        ScriptedTransport.awaitCondition(
            () -> service.getAcknowledgedPositions().size() == 1, 2000));

    cancellationToken.complete(null);
    handler.cancelActiveSession("test shutdown");
    serving.get(5, TimeUnit.SECONDS);

    assertEquals(SessionState.CANCELLED, handler.getState());
    assertTrue(ScriptedTransport.awaitCondition(service::isCallFinished, 2000));
  }

  /** Keeps every call open without sending anything until the test acts on it. */
  private static class IdleCdcService extends PluginServiceGrpc.PluginServiceImplBase {
    private final CompletableFuture<StreamObserver<ServerMessage>> call =
        new CompletableFuture<>();

    @Override
    public StreamObserver<ClientMessage> session(StreamObserver<ServerMessage> responseObserver) {
      call.complete(responseObserver);
      return new StreamObserver<ClientMessage>() {
        @Override
        public void onNext(ClientMessage message) {}

        @Override
        public void onError(Throwable t) {}

        @Override
        public void onCompleted() {}
      };
    }
  }

  /**
   * Sends the scripted messages in lock step with the client's acknowledgments: the next message
   * goes out only after the previous one was acknowledged. Then it finishes the call, fails it,
   * or keeps it open.
   */
  private static class ScriptedCdcService extends PluginServiceGrpc.PluginServiceImplBase {
    private final List<ServerMessage> script;
    @Nullable private final Status failure;
    private final boolean holdOpen;
    @Nullable private final Status rejection;
    private final List<Long> acks = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean callFinished = false;

    ScriptedCdcService(
        List<ServerMessage> script,
        @Nullable Status failure,
        boolean holdOpen,
        @Nullable Status rejection) {
      this.script = script;
      this.failure = failure;
      this.holdOpen = holdOpen;
      this.rejection = rejection;
    }

    List<Long> getAcknowledgedPositions() {
      synchronized (acks) {
        return new ArrayList<>(acks);
      }
    }

    boolean isCallFinished() {
      return callFinished;
    }

    @Override
    public StreamObserver<ClientMessage> session(StreamObserver<ServerMessage> responseObserver) {
      AtomicInteger next = new AtomicInteger();
      if (rejection != null) {
        responseObserver.onError(rejection.asRuntimeException());
      } else {
        sendNextOrFinish(responseObserver, 0);
      }

      return new StreamObserver<ClientMessage>() {
        @Override
        public void onNext(ClientMessage message) {
          acks.add(message.getAck().getPgLsn());
          sendNextOrFinish(responseObserver, next.incrementAndGet());
        }

        @Override
        public void onError(Throwable t) {
          callFinished = true;
        }

        @Override
        public void onCompleted() {
          callFinished = true;
        }
      };
    }

    private void sendNextOrFinish(StreamObserver<ServerMessage> responseObserver, int index) {
      if (index < script.size()) {
        responseObserver.onNext(script.get(index));
      } else if (holdOpen) {
        return;
      } else if (failure != null) {
        responseObserver.onError(failure.asRuntimeException());
      } else {
        responseObserver.onCompleted();
      }
    }
  }
}
