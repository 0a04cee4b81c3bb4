package com.walstream.client.transport;

import com.walstream.client.DialException;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * Establishes connections to the CDC service.
 *
 * <p>Each call to {@link #dial(CompletableFuture)} produces a new, independent connection. The caller owns it and
 * must close it.
 */
public interface Transport {

  /**
   * Establishes a new connection.
   *
   * <p>A dial that is still waiting for the endpoint gives up with a {@link DialException} soon
   * after the cancellation token completes.
   *
   * @param cancellationToken token completed on shutdown
   * @return a connection that is ready to open a session
   * @throws DialException if the connection cannot be established or the dial was cancelled
   */
  @Nonnull
  Connection dial(@Nonnull CompletableFuture<Void> cancellationToken) throws DialException;
}
