package com.scholary.tracklist.identify;

import java.util.Map;

/**
 * Counters for one orchestrator.
 *
 * @param cacheHits segments answered from the cache
 * @param providerCalls provider requests issued, retries included
 * @param exhaustedSegments segments on which every provider failed
 * @param providerCallsByName provider requests per provider
 * @param circuitTripsByName times each provider's circuit breaker opened
 */
public record OrchestratorStats(
    long cacheHits,
    long providerCalls,
    long exhaustedSegments,
    Map<String, Long> providerCallsByName,
    Map<String, Long> circuitTripsByName) {

  public OrchestratorStats {
    providerCallsByName = Map.copyOf(providerCallsByName);
    circuitTripsByName = Map.copyOf(circuitTripsByName);
  }
}
