package com.scholary.tracklist.ratelimit;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;

/**
 * Token bucket settings.
 *
 * @param enabled when false, {@link RateLimiter#acquire} never waits
 * @param maxRequestsPerWindow default bucket capacity
 * @param window default time in which a full bucket refills
 * @param providers per-provider overrides keyed by provider name
 */
public record RateLimitProperties(
    boolean enabled,
    @Positive int maxRequestsPerWindow,
    @NotNull Duration window,
    Map<String, @Valid Limit> providers) {

  public RateLimitProperties {
    providers = providers == null ? Map.of() : Map.copyOf(providers);
  }

  public record Limit(@Positive int maxRequestsPerWindow, @NotNull Duration window) {}

  public Limit limitFor(String provider) {
    return providers.getOrDefault(provider, new Limit(maxRequestsPerWindow, window));
  }
}
