package com.walstream.client;

import com.walstream.client.event.LogPositions;
import com.walstream.client.retry.RetryPolicy;
import com.walstream.client.session.SessionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the client connected to the CDC service until it is shut down.
 *
 * <p>{@link #run()} repeatedly calls {@link SessionHandler#connectAndServe()}. Every failed
 * attempt is logged and followed by the delay the {@link RetryPolicy} returns for the number of
 * consecutive failures. There is no retry limit. Attempts are strictly sequential: an attempt
 * has released its connection before the next one starts.
 *
 * <p>The consecutive failure count goes back to zero once a session has acknowledged at least
 * one event.
 *
 * <p>{@link #shutdown()} may be called from any thread. It stops the manager at the next
 * checkpoint: before a dial, during the retry wait, or inside a running session.
 */
public class ConnectionManager {
  private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

  private final SessionHandler sessionHandler;
  private final RetryPolicy retryPolicy;
  private final CompletableFuture<Void> cancellationToken;

  private final AtomicInteger attempts = new AtomicInteger();
  private volatile int consecutiveFailures = 0;

  /**
   * Creates a connection manager.
   *
   * @param sessionHandler the handler that runs each session
   * @param retryPolicy the policy pacing reconnect attempts
   * @param cancellationToken token completed on shutdown; must be the one the session handler
   *     checks
   */
  public ConnectionManager(
      @Nonnull SessionHandler sessionHandler,
      @Nonnull RetryPolicy retryPolicy,
      @Nonnull CompletableFuture<Void> cancellationToken) {
    this.sessionHandler = Objects.requireNonNull(sessionHandler, "sessionHandler cannot be null");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
    this.cancellationToken =
        Objects.requireNonNull(cancellationToken, "cancellationToken cannot be null");
  }

  /**
   * Connects and reconnects until {@link #shutdown()} is called.
   *
   * <p>Connectivity failures never escape this method.
   */
  public void run() {
    logger.debug("Connection manager started with {}", retryPolicy);
    while (!cancellationToken.isDone()) {
      int attempt = attempts.incrementAndGet();
      try {
        sessionHandler.connectAndServe();
        // Normal return only happens on shutdown.
        break;
      } catch (WalstreamException e) {
        if (cancellationToken.isDone()) {
          break;
        }
        if (e instanceof StreamException
            && ((StreamException) e).getLastAcknowledgedPosition().isPresent()) {
          consecutiveFailures = 0;
        }
        consecutiveFailures++;
        Duration delay = retryPolicy.nextDelay(consecutiveFailures);
        logFailure(attempt, e, delay);
        if (!awaitRetry(delay)) {
          break;
        }
      }
    }
    logger.info("Connection manager stopped after {} attempt(s)", attempts.get());
  }

  /**
   * Requests shutdown.
   *
   * <p>Completes the cancellation token and cancels the session being served, so {@link #run()}
   * returns without another attempt.
   */
  public void shutdown() {
    if (cancellationToken.complete(null)) {
      logger.info("Shutdown requested");
    }
    sessionHandler.cancelActiveSession("client shutdown");
  }

  /** Returns whether shutdown has been requested. */
  public boolean isShutdown() {
    return cancellationToken.isDone();
  }

  /** Returns the number of connection attempts started so far. */
  public int getAttemptCount() {
    return attempts.get();
  }

  /** Returns the number of consecutive failed attempts. */
  public int getConsecutiveFailureCount() {
    return consecutiveFailures;
  }

  private void logFailure(int attempt, WalstreamException e, Duration delay) {
    String acked = "";
    if (e instanceof StreamException) {
      OptionalLong position = ((StreamException) e).getLastAcknowledgedPosition();
      if (position.isPresent()) {
        acked = ", last acknowledged " + LogPositions.format(position.getAsLong());
      }
    }
    logger.warn(
        "Connection attempt {} failed ({}{}): {}. Reconnecting in {}ms",
        attempt,
        e.getClass().getSimpleName(),
        acked,
        e.getMessage(),
        delay.toMillis());
    logger.debug("Connection attempt {} failure", attempt, e);
  }

  // Returns false when shutdown interrupted the wait.
  private boolean awaitRetry(Duration delay) {
    try {
      cancellationToken.get(delay.toMillis(), TimeUnit.MILLISECONDS);
      return false;
    } catch (TimeoutException e) {
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting to reconnect, stopping");
      return false;
    } catch (ExecutionException | CancellationException e) {
      logger.debug("Cancellation token completed exceptionally, stopping", e);
      return false;
    }
  }
}
