package com.scholary.tracklist.cache;

import com.scholary.tracklist.provider.ProviderResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cache of provider results keyed by segment fingerprint.
 *
 * <p>Lets a re-run over the same mix, or a repeated passage within one, skip the providers
 * entirely. Safe for concurrent use; concurrent writes of the same fingerprint are last write
 * wins.
 */
public interface IdentificationCache {

  /**
   * Look up a fingerprint.
   *
   * @param fingerprint see {@link SegmentFingerprint}
   * @return the entry, or empty if absent, expired or the store is unavailable
   */
  Optional<CacheEntry> get(String fingerprint);

  /**
   * Store results for a fingerprint. Failures of the underlying store are logged, not thrown.
   *
   * @param fingerprint see {@link SegmentFingerprint}
   * @param results ranked results, best first
   * @param ttl how long the entry stays valid
   */
  void put(String fingerprint, List<ProviderResult> results, Duration ttl);

  CacheStats stats();
}
