package com.scholary.tracklist.retry;

import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.provider.ErrorKind;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed provider attempt is retried and how long to wait first.
 *
 * <p>Exponential backoff with jitter: attempt {@code n} waits {@code baseDelay * 2^(n-1)} plus up
 * to half of that again, capped at {@code maxDelay}. Rate-limited attempts wait exactly as long as
 * the provider's Retry-After hint says when one was sent; {@code maxDelay} does not apply to it.
 * Non-transient errors are never retried.
 *
 * <p>Stateless; one instance is shared by all segments.
 */
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final DoubleSupplier jitter;

  public RetryPolicy(RetryProperties properties) {
    this(
        properties.maxAttempts(),
        properties.baseDelay(),
        properties.maxDelay(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param jitter source of values in [0, 1); tests pass a constant
   */
  public RetryPolicy(
      int maxAttempts, Duration baseDelay, Duration maxDelay, DoubleSupplier jitter) {
    if (maxAttempts < 1) {
      throw new ConfigurationException("retry.maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
      throw new ConfigurationException(
          "retry delays must satisfy 0 <= baseDelay <= maxDelay, got "
              + baseDelay
              + " and "
              + maxDelay);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.jitter = jitter;
  }

  /**
   * Delay before the next attempt.
   *
   * @param attempt the 1-based number of the attempt that just failed
   * @param kind how it failed
   * @param retryAfterHint provider-supplied wait, may be null
   * @return the delay, or empty to give up on this provider
   */
  public Optional<Duration> nextDelay(int attempt, ErrorKind kind, Duration retryAfterHint) {
    if (!kind.isTransient() || attempt >= maxAttempts) {
      return Optional.empty();
    }
    if (kind == ErrorKind.RATE_LIMITED && retryAfterHint != null && !retryAfterHint.isNegative()) {
      return Optional.of(retryAfterHint);
    }
    long backoffMillis = baseDelay.toMillis() << Math.min(attempt - 1, 30);
    if (backoffMillis < 0) {
      return Optional.of(maxDelay);
    }
    long jitterMillis = (long) (jitter.getAsDouble() * (backoffMillis / 2.0));
    return Optional.of(min(Duration.ofMillis(backoffMillis + jitterMillis), maxDelay));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
