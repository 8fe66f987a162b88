package com.scholary.tracklist.cache;

import com.scholary.tracklist.provider.ProviderResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Used when caching is switched off. Every lookup misses. */
public class NoOpIdentificationCache implements IdentificationCache {

  @Override
  public Optional<CacheEntry> get(String fingerprint) {
    return Optional.empty();
  }

  @Override
  public void put(String fingerprint, List<ProviderResult> results, Duration ttl) {}

  @Override
  public CacheStats stats() {
    return new CacheStats(0, 0, 0, 0);
  }
}
