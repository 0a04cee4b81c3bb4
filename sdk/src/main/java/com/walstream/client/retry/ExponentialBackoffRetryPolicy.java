package com.walstream.client.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import javax.annotation.Nonnull;

/**
 * Capped exponential backoff with optional jitter.
 *
 * <p>The base delay for attempt {@code n} is {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}. With a jitter factor {@code j} the actual delay is drawn uniformly from {@code
 * [base * (1 - j), base]}, so reconnecting clients spread out instead of hitting the server
 * together.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .jitter(0.2)
 *     .build();
 * }</pre>
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double multiplier;
  private final double jitter;
  private final DoubleSupplier random;

  private ExponentialBackoffRetryPolicy(Builder builder) {
    this.initialDelayMs = builder.initialDelay.toMillis();
    this.maxDelayMs = builder.maxDelay.toMillis();
    this.multiplier = builder.multiplier;
    this.jitter = builder.jitter;
    this.random = builder.random;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  @Nonnull
  public Duration nextDelay(int attempt) {
    int exponent = Math.max(0, attempt - 1);
    double base = initialDelayMs * Math.pow(multiplier, exponent);
    long capped = base >= maxDelayMs ? maxDelayMs : (long) base;
    if (jitter == 0.0) {
      return Duration.ofMillis(capped);
    }
    double factor = 1.0 - jitter * random.getAsDouble();
    return Duration.ofMillis((long) (capped * factor));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy{initial="
        + initialDelayMs
        + "ms, max="
        + maxDelayMs
        + "ms, multiplier="
        + multiplier
        + ", jitter="
        + jitter
        + "}";
  }

  /** Builder for {@link ExponentialBackoffRetryPolicy}. */
  public static class Builder {
    private Duration initialDelay = Duration.ofMillis(500);
    private Duration maxDelay = Duration.ofSeconds(30);
    private double multiplier = 2.0;
    private double jitter = 0.0;
    private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

    private Builder() {}

    public Builder initialDelay(@Nonnull Duration initialDelay) {
      Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
      if (initialDelay.isNegative()) {
        throw new IllegalArgumentException("initialDelay must be non-negative");
      }
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder maxDelay(@Nonnull Duration maxDelay) {
      Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
      if (maxDelay.isNegative()) {
        throw new IllegalArgumentException("maxDelay must be non-negative");
      }
      this.maxDelay = maxDelay;
      return this;
    }

    public Builder multiplier(double multiplier) {
      if (multiplier < 1.0) {
        throw new IllegalArgumentException("multiplier must be at least 1.0");
      }
      this.multiplier = multiplier;
      return this;
    }

    /**
     * Sets the jitter factor.
     *
     * @param jitter fraction of the delay that may be randomly removed, between 0.0 and 1.0
     * @return this builder
     */
    public Builder jitter(double jitter) {
      if (jitter < 0.0 || jitter > 1.0) {
        throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
      }
      this.jitter = jitter;
      return this;
    }

    /** Replaces the random source, which must return values in {@code [0, 1)}. */
    Builder random(@Nonnull DoubleSupplier random) {
      this.random = Objects.requireNonNull(random, "random cannot be null");
      return this;
    }

    public ExponentialBackoffRetryPolicy build() {
      if (maxDelay.compareTo(initialDelay) < 0) {
        throw new IllegalArgumentException("maxDelay must not be smaller than initialDelay");
      }
      return new ExponentialBackoffRetryPolicy(this);
    }
  }
}
