package com.scholary.tracklist.pipeline;

import java.util.Map;

/**
 * What happened during a run.
 *
 * @param segmentsTotal segments the source splits into
 * @param segmentsProcessed segments delivered to the matcher
 * @param cacheHits segments answered from the cache
 * @param providerCalls provider requests, retries included
 * @param exhaustedSegments segments on which every provider failed
 * @param unreadableSegments segments whose audio could not be read, delivered as failures
 * @param providerCallsByName provider requests per provider
 * @param circuitTripsByName times each provider's circuit breaker opened
 * @param cancelled whether the run was cancelled or ran out of time
 * @param elapsedMs wall-clock duration of the run
 */
public record PipelineDiagnostics(
    int segmentsTotal,
    int segmentsProcessed,
    long cacheHits,
    long providerCalls,
    long exhaustedSegments,
    int unreadableSegments,
    Map<String, Long> providerCallsByName,
    Map<String, Long> circuitTripsByName,
    boolean cancelled,
    long elapsedMs) {

  public PipelineDiagnostics {
    providerCallsByName = Map.copyOf(providerCallsByName);
    circuitTripsByName = Map.copyOf(circuitTripsByName);
  }
}
