package com.scholary.tracklist.ratelimit;

import java.time.Duration;

/**
 * Counters for one provider's bucket.
 *
 * @param acquisitions permits granted
 * @param delayedAcquisitions permits that had to wait for a refill
 * @param totalWait time spent waiting, summed over all callers
 */
public record RateLimitMetrics(long acquisitions, long delayedAcquisitions, Duration totalWait) {

  public static final RateLimitMetrics EMPTY = new RateLimitMetrics(0, 0, Duration.ZERO);
}
