package com.walstream.client.retry;

import java.time.Duration;
import javax.annotation.Nonnull;

/**
 * Decides how long the connection manager waits before the next connection attempt.
 *
 * <p>There is no give-up decision: the manager retries until it is shut down. A policy only
 * controls the pacing, so it must never return a negative delay.
 *
 * @see FixedDelayRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Returns the delay to wait after a failed attempt.
   *
   * @param attempt the number of consecutive failed attempts so far, starting at 1
   * @return the delay before the next attempt
   */
  @Nonnull
  Duration nextDelay(int attempt);
}
