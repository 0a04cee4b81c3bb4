package com.walstream.client.retry;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;

/** Waits the same delay after every failed attempt. */
public class FixedDelayRetryPolicy implements RetryPolicy {

  /** The default reconnect delay: 2 seconds. */
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(2);

  private final Duration delay;

  /** Creates a policy with {@link #DEFAULT_DELAY}. */
  public FixedDelayRetryPolicy() {
    this(DEFAULT_DELAY);
  }

  public FixedDelayRetryPolicy(@Nonnull Duration delay) {
    Objects.requireNonNull(delay, "delay cannot be null");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be non-negative");
    }
    this.delay = delay;
  }

  @Override
  @Nonnull
  public Duration nextDelay(int attempt) {
    return delay;
  }

  @Override
  public String toString() {
    return "FixedDelayRetryPolicy{delay=" + delay.toMillis() + "ms}";
  }
}
