package com.walstream.client.session;

import com.walstream.client.ClientAck;
import com.walstream.client.ClientMessage;
import com.walstream.client.DialException;
import com.walstream.client.ServerMessage;
import com.walstream.client.SessionOpenException;
import com.walstream.client.SessionState;
import com.walstream.client.StreamException;
import com.walstream.client.UnrecognizedEventPolicy;
import com.walstream.client.WalstreamException;
import com.walstream.client.event.ChangeEvent;
import com.walstream.client.event.ChangeEventConsumer;
import com.walstream.client.event.ChangeEvents;
import com.walstream.client.event.LogPositions;
import com.walstream.client.transport.Connection;
import com.walstream.client.transport.EventStream;
import com.walstream.client.transport.Transport;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one CDC session end to end and reports how it ended.
 *
 * <p>{@link #connectAndServe()} dials, opens the bidirectional session and then loops:
 *
 * <ol>
 *   <li>receive one server message, blocking until it arrives
 *   <li>convert it to a {@link ChangeEvent} and hand it to the {@link ChangeEventConsumer}
 *   <li>send a {@link ClientAck} carrying the event's log position
 * </ol>
 *
 * <p>At most one event is unacknowledged at any time: the next message is requested only after
 * the acknowledgment of the previous one has been handed to the transport. A slow consumer
 * therefore slows down the server, and acknowledgments always follow receipt order.
 *
 * <p>Messages of a variant this client does not know are skipped without acknowledgment,
 * according to the configured {@link UnrecognizedEventPolicy}.
 *
 * <p>The cancellation token is checked before dialing, before every receive and before every
 * send. Completing it makes {@link #connectAndServe()} return normally; {@link
 * #cancelActiveSession(String)} additionally unblocks a receive that is already waiting.
 *
 * <p>A handler is meant to be driven by one thread at a time. The connection and the stream
 * opened by an invocation are closed before it returns, whichever way it ends.
 */
public class SessionHandler {
  private static final Logger logger = LoggerFactory.getLogger(SessionHandler.class);

  private final Transport transport;
  private final ChangeEventConsumer consumer;
  private final UnrecognizedEventPolicy unrecognizedEventPolicy;
  private final CompletableFuture<Void> cancellationToken;

  private final AtomicReference<EventStream> activeStream = new AtomicReference<>();
  private final AtomicLong dispatchedEvents = new AtomicLong();
  private final AtomicLong acknowledgedEvents = new AtomicLong();
  private final AtomicLong unrecognizedEvents = new AtomicLong();
  private volatile SessionState state = SessionState.IDLE;

  public SessionHandler(
      @Nonnull Transport transport,
      @Nonnull ChangeEventConsumer consumer,
      @Nonnull UnrecognizedEventPolicy unrecognizedEventPolicy,
      @Nonnull CompletableFuture<Void> cancellationToken) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
    this.unrecognizedEventPolicy =
        Objects.requireNonNull(unrecognizedEventPolicy, "unrecognizedEventPolicy cannot be null");
    this.cancellationToken =
        Objects.requireNonNull(cancellationToken, "cancellationToken cannot be null");
  }

  /**
   * Runs one session until it fails or the cancellation token completes.
   *
   * @throws DialException if the connection cannot be established
   * @throws SessionOpenException if the session cannot be started or is rejected by the remote
   * @throws StreamException if the session fails or is closed by the remote after it started
   */
  public void connectAndServe() throws WalstreamException {
    if (isCancelled()) {
      setState(SessionState.CANCELLED);
      return;
    }

    setState(SessionState.DIALING);
    try (Connection connection = dial()) {
      setState(SessionState.SESSION_OPENING);
      try (EventStream stream = openSession(connection)) {
        activeStream.set(stream);
        try {
          serve(stream);
        } finally {
          activeStream.set(null);
        }
      }
    } catch (StreamException e) {
      if (isCancelled()) {
        setState(SessionState.CANCELLED);
        return;
      }
      setState(e.isClosedByRemote() ? SessionState.CLOSED_BY_REMOTE : SessionState.CLOSED_BY_ERROR);
      throw e;
    } catch (WalstreamException e) {
      if (isCancelled()) {
        setState(SessionState.CANCELLED);
        return;
      }
      setState(SessionState.CLOSED_BY_ERROR);
      throw e;
    }
  }

  /**
   * Cancels the session currently being served, if any.
   *
   * <p>Call this after completing the cancellation token; on its own it only ends the current
   * session, which is then reported as a {@link StreamException}.
   *
   * @param reason human-readable reason, used in diagnostics
   */
  public void cancelActiveSession(@Nonnull String reason) {
    EventStream stream = activeStream.get();
    if (stream != null) {
      logger.debug("Cancelling active session: {}", reason);
      stream.cancel(reason);
    }
  }

  /** Returns the state of the current or most recent attempt. */
  public SessionState getState() {
    return state;
  }

  /** Returns how many events were handed to the consumer, over all sessions. */
  public long getDispatchedEventCount() {
    return dispatchedEvents.get();
  }

  /** Returns how many acknowledgments were sent, over all sessions. */
  public long getAcknowledgedEventCount() {
    return acknowledgedEvents.get();
  }

  /** Returns how many messages of unknown variant were skipped, over all sessions. */
  public long getUnrecognizedEventCount() {
    return unrecognizedEvents.get();
  }

  private Connection dial() {
    try {
      return transport.dial(cancellationToken);
    } catch (DialException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DialException("Dial failed: " + e.getMessage(), e);
    }
  }

  private EventStream openSession(Connection connection) {
    try {
      return connection.openSession();
    } catch (SessionOpenException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionOpenException("Failed to open session: " + e.getMessage(), e);
    }
  }

  private void serve(EventStream stream) {
    if (isCancelled()) {
      setState(SessionState.CANCELLED);
      return;
    }
    setState(SessionState.ACTIVE);
    logger.info("Session active, listening for events");

    @Nullable Long lastAcknowledged = null;
    // One unacknowledged event at most: every path that skips the ack leaves this loop.
    while (true) {
      if (isCancelled()) {
        setState(SessionState.CANCELLED);
        return;
      }

      ServerMessage message = receive(stream, lastAcknowledged);
      Optional<ChangeEvent> event = ChangeEvents.fromServerMessage(message);
      if (!event.isPresent()) {
        skipUnrecognized(message);
        continue;
      }

      ChangeEvent changeEvent = event.get();
      if (lastAcknowledged != null
          && Long.compareUnsigned(changeEvent.getLogPosition(), lastAcknowledged) <= 0) {
        logger.warn(
            "Received {} at {} which does not follow the last acknowledged position {}",
            changeEvent.getKind(),
            LogPositions.format(changeEvent.getLogPosition()),
            LogPositions.format(lastAcknowledged));
      }

      dispatch(changeEvent, lastAcknowledged);

      if (isCancelled()) {
        setState(SessionState.CANCELLED);
        return;
      }
      acknowledge(stream, changeEvent, lastAcknowledged);
      lastAcknowledged = changeEvent.getLogPosition();
    }
  }

  private ServerMessage receive(EventStream stream, @Nullable Long lastAcknowledged) {
    try {
      return stream.receive();
    } catch (SessionOpenException e) {
      throw e;
    } catch (StreamException e) {
      throw new StreamException(
          "Receive failed: " + e.getMessage(), e, lastAcknowledged, e.isClosedByRemote());
    } catch (RuntimeException e) {
      throw new StreamException("Receive failed: " + e.getMessage(), e, lastAcknowledged, false);
    }
  }

  private void dispatch(ChangeEvent event, @Nullable Long lastAcknowledged) {
    try {
      consumer.accept(event);
    } catch (RuntimeException e) {
      throw new StreamException(
          "Consumer failed on " + event + ": " + e.getMessage(), e, lastAcknowledged, false);
    }
    dispatchedEvents.incrementAndGet();
    logger.debug(
        "Dispatched {} {} at {}",
        event.getKind(),
        event.getQualifiedTableName(),
        LogPositions.format(event.getLogPosition()));
  }

  private void acknowledge(EventStream stream, ChangeEvent event, @Nullable Long lastAcknowledged) {
    ClientMessage ack =
        ClientMessage.newBuilder()
            .setAck(ClientAck.newBuilder().setPgLsn(event.getLogPosition()).build())
            .build();
    try {
      stream.send(ack);
    } catch (RuntimeException e) {
      throw new StreamException(
          "Failed to acknowledge " + LogPositions.format(event.getLogPosition()) + ": "
              + e.getMessage(),
          e,
          lastAcknowledged,
          false);
    }
    acknowledgedEvents.incrementAndGet();
  }

  private void skipUnrecognized(ServerMessage message) {
    long count = unrecognizedEvents.incrementAndGet();
    if (unrecognizedEventPolicy == UnrecognizedEventPolicy.WARN) {
      logger.warn(
          "Skipping server message of unknown variant without acknowledgment ({} so far)",
          count);
    } else {
      logger.debug("Skipping server message of unknown variant: {}", message.getMsgCase());
    }
  }

  private boolean isCancelled() {
    return cancellationToken.isDone();
  }

  private void setState(SessionState newState) {
    state = newState;
    logger.debug("Session state -> {}", newState);
  }
}
