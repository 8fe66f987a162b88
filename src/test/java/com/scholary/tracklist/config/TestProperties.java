package com.scholary.tracklist.config;

import com.scholary.tracklist.config.TracklistProperties.CacheProperties;
import com.scholary.tracklist.identify.CircuitBreakerProperties;
import com.scholary.tracklist.ratelimit.RateLimitProperties;
import com.scholary.tracklist.retry.RetryProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Configuration values shared by tests; mirrors application.yml. */
public final class TestProperties {

  private TestProperties() {}

  public static TracklistProperties tracklist() {
    return tracklist(null);
  }

  public static TracklistProperties tracklist(Double acceptanceThreshold) {
    return new TracklistProperties(
        60,
        0,
        0.8,
        acceptanceThreshold,
        60,
        2,
        List.of("acrcloud", "audd"),
        true,
        Duration.ofHours(1),
        4,
        8,
        2,
        50,
        new RetryProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(30)),
        new RateLimitProperties(true, 60, Duration.ofMinutes(1), Map.of()),
        new CircuitBreakerProperties(true, 5, Duration.ofSeconds(60)),
        new CacheProperties(true, CacheProperties.Backend.MEMORY, 1000, null, null));
  }
}
