package com.scholary.tracklist.ratelimit;

import com.scholary.tracklist.config.ConfigurationException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-provider token buckets shared by all segment workers.
 *
 * <p>A bucket holds up to {@code maxRequestsPerWindow} tokens and refills continuously at {@code
 * maxRequestsPerWindow / window}. {@link #acquire} takes one token, blocking until one is
 * available. Requests are delayed, never dropped. Waiters are served in arrival order.
 */
public class RateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  private final RateLimitProperties properties;
  private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

  public RateLimiter(RateLimitProperties properties) {
    if (properties.maxRequestsPerWindow() < 1 || !isPositive(properties.window())) {
      throw new ConfigurationException(
          "ratelimit needs maxRequestsPerWindow >= 1 and a window > 0");
    }
    properties
        .providers()
        .forEach(
            (name, limit) -> {
              if (limit.maxRequestsPerWindow() < 1 || !isPositive(limit.window())) {
                throw new ConfigurationException("Invalid rate limit for provider " + name);
              }
            });
    this.properties = properties;
  }

  /**
   * Take a token for the provider, waiting for a refill if the bucket is empty.
   *
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  public void acquire(String provider) throws InterruptedException {
    if (!properties.enabled()) {
      return;
    }
    bucket(provider).acquire();
  }

  /**
   * Fraction of the bucket currently used, in [0, 1]. 0 for providers never seen.
   */
  public double utilization(String provider) {
    Bucket bucket = buckets.get(provider);
    return bucket == null ? 0.0 : bucket.utilization();
  }

  public RateLimitMetrics metrics(String provider) {
    Bucket bucket = buckets.get(provider);
    return bucket == null ? RateLimitMetrics.EMPTY : bucket.metrics();
  }

  public boolean isEnabled() {
    return properties.enabled();
  }

  private Bucket bucket(String provider) {
    return buckets.computeIfAbsent(
        provider,
        name -> {
          RateLimitProperties.Limit limit = properties.limitFor(name);
          LOGGER.info(
              "Rate limit for {}: {} requests per {}",
              name,
              limit.maxRequestsPerWindow(),
              limit.window());
          return new Bucket(name, limit.maxRequestsPerWindow(), limit.window());
        });
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  private static final class Bucket {

    private final String provider;
    private final double capacity;
    private final double nanosPerToken;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition refilled = lock.newCondition();

    private double tokens;
    private long lastRefillNanos;
    private long acquisitions;
    private long delayedAcquisitions;
    private long totalWaitNanos;

    Bucket(String provider, int capacity, Duration window) {
      this.provider = provider;
      this.capacity = capacity;
      this.nanosPerToken = (double) window.toNanos() / capacity;
      this.tokens = capacity;
      this.lastRefillNanos = System.nanoTime();
    }

    void acquire() throws InterruptedException {
      lock.lockInterruptibly();
      try {
        long start = System.nanoTime();
        boolean waited = false;
        refill();
        while (tokens < 1.0) {
          if (!waited) {
            LOGGER.debug("Rate limit reached for {}, waiting for a token", provider);
            waited = true;
          }
          long waitNanos = (long) Math.ceil((1.0 - tokens) * nanosPerToken);
          refilled.awaitNanos(Math.max(waitNanos, TimeUnit.MICROSECONDS.toNanos(100)));
          refill();
        }
        tokens -= 1.0;
        acquisitions++;
        if (waited) {
          delayedAcquisitions++;
          totalWaitNanos += System.nanoTime() - start;
        }
        if (tokens >= 1.0) {
          refilled.signal();
        }
      } finally {
        lock.unlock();
      }
    }

    double utilization() {
      lock.lock();
      try {
        refill();
        return Math.max(0.0, Math.min(1.0, 1.0 - tokens / capacity));
      } finally {
        lock.unlock();
      }
    }

    RateLimitMetrics metrics() {
      lock.lock();
      try {
        return new RateLimitMetrics(
            acquisitions, delayedAcquisitions, Duration.ofNanos(totalWaitNanos));
      } finally {
        lock.unlock();
      }
    }

    private void refill() {
      long now = System.nanoTime();
      long elapsed = now - lastRefillNanos;
      if (elapsed > 0) {
        tokens = Math.min(capacity, tokens + elapsed / nanosPerToken);
        lastRefillNanos = now;
      }
    }
  }
}
