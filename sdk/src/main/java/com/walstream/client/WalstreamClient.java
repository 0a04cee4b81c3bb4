package com.walstream.client;

import com.walstream.client.event.ChangeEventConsumer;
import com.walstream.client.session.SessionHandler;
import com.walstream.client.transport.Transport;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for the Walstream client.
 *
 * <p>A client connects to the CDC service, hands every change event to a {@link
 * ChangeEventConsumer} and acknowledges it. Connection failures are retried forever, paced by the
 * configured {@link com.walstream.client.retry.RetryPolicy}, until the client is closed.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * WalstreamClient client = WalstreamClient.builder(event -> System.out.println(event))
 *     .options(ClientConfigurationOptions.builder()
 *         .setHost("cdc.internal")
 *         .setPort(50051)
 *         .build())
 *     .build();
 *
 * CompletableFuture<Void> stopped = client.start();
 *
 * // Later, from any thread
 * client.close();
 * }</pre>
 *
 * <p>{@link #run()} can be used instead of {@link #start()} to drive the client on the calling
 * thread.
 */
public class WalstreamClient implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(WalstreamClient.class);
  private static final long CLOSE_TIMEOUT_MS = 10_000;

  /** The current version of the Walstream client. */
  public static final String VERSION = "0.1.0";

  private final ClientConfigurationOptions options;
  private final SessionHandler sessionHandler;
  private final ConnectionManager connectionManager;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile CompletableFuture<Void> completion;
  private volatile ExecutorService executor;

  /**
   * Creates a client for the given options.
   *
   * <p>This constructor is package-private and intended for use by {@link WalstreamClientBuilder}.
   */
  WalstreamClient(
      @Nonnull ClientConfigurationOptions options,
      @Nonnull Transport transport,
      @Nonnull ChangeEventConsumer consumer) {
    this.options = Objects.requireNonNull(options, "options cannot be null");
    CompletableFuture<Void> cancellationToken = new CompletableFuture<>();
    this.sessionHandler =
        new SessionHandler(
            Objects.requireNonNull(transport, "transport cannot be null"),
            Objects.requireNonNull(consumer, "consumer cannot be null"),
            options.unrecognizedEventPolicy(),
            cancellationToken);
    this.connectionManager =
        new ConnectionManager(sessionHandler, options.retryPolicy(), cancellationToken);
  }

  /**
   * Creates a new builder for configuring a WalstreamClient instance.
   *
   * @param consumer receives every change event, in log order
   * @return a new builder
   */
  @Nonnull
  public static WalstreamClientBuilder builder(@Nonnull ChangeEventConsumer consumer) {
    return new WalstreamClientBuilder(consumer);
  }

  /**
   * Runs the client on the calling thread until {@link #close()} is called.
   *
   * @throws IllegalStateException if the client was already started
   */
  public void run() {
    markStarted();
    logger.info("Starting Walstream client {} for {}", VERSION, options.target());
    connectionManager.run();
  }

  /**
   * Runs the client on a background daemon thread.
   *
   * @return a future that completes once the client has stopped
   * @throws IllegalStateException if the client was already started
   */
  @Nonnull
  public CompletableFuture<Void> start() {
    markStarted();
    logger.info("Starting Walstream client {} for {}", VERSION, options.target());
    ExecutorService worker = createDefaultExecutor();
    executor = worker;
    CompletableFuture<Void> future = CompletableFuture.runAsync(connectionManager::run, worker);
    completion = future;
    return future;
  }

  /** Returns whether the client is currently connected and streaming events. */
  public boolean isActive() {
    return sessionHandler.getState() == SessionState.ACTIVE;
  }

  /** Returns the state of the current or most recent session. */
  @Nonnull
  public SessionState getSessionState() {
    return sessionHandler.getState();
  }

  /** Returns how many events were acknowledged since the client started. */
  public long getAcknowledgedEventCount() {
    return sessionHandler.getAcknowledgedEventCount();
  }

  /** Returns how many connection attempts were made since the client started. */
  public int getAttemptCount() {
    return connectionManager.getAttemptCount();
  }

  /** Returns the options this client was built with. */
  @Nonnull
  public ClientConfigurationOptions getOptions() {
    return options;
  }

  /**
   * Stops the client and releases its resources.
   *
   * <p>The active session, if any, is cancelled and its connection closed. When the client was
   * started with {@link #start()}, this method waits for the background thread to finish.
   */
  @Override
  public void close() {
    logger.debug("Closing WalstreamClient");
    connectionManager.shutdown();

    CompletableFuture<Void> future = completion;
    if (future != null) {
      try {
        future.get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        logger.warn("Client did not stop within {}ms", CLOSE_TIMEOUT_MS);
      } catch (ExecutionException e) {
        logger.warn("Client stopped with an error", e.getCause());
      } catch (InterruptedException e) {
        logger.warn("Interrupted while waiting for the client to stop");
        Thread.currentThread().interrupt();
      }
    }
    ExecutorService worker = executor;
    if (worker != null) {
      worker.shutdownNow();
    }
  }

  /**
   * Returns the current version of the Walstream client.
   *
   * @return the version string (e.g., "0.1.0")
   */
  public static String getVersion() {
    return VERSION;
  }

  private void markStarted() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Client was already started");
    }
  }

  private static ExecutorService createDefaultExecutor() {
    ThreadFactory factory =
        new ThreadFactory() {
          private final AtomicInteger counter = new AtomicInteger(0);

          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("WalstreamClient-worker-" + counter.getAndIncrement());
            return t;
          }
        };
    return Executors.newSingleThreadExecutor(factory);
  }
}
