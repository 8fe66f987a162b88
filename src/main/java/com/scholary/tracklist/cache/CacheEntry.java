package com.scholary.tracklist.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.tracklist.provider.ProviderResult;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Results cached for one segment fingerprint, in the order the orchestrator ranked them.
 */
public record CacheEntry(
    String segmentFingerprint, List<ProviderResult> results, Instant createdAt, Duration ttl) {

  public CacheEntry {
    results = List.copyOf(results);
  }

  @JsonIgnore
  public Instant expiresAt() {
    return createdAt.plus(ttl);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt());
  }
}
