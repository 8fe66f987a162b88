package com.scholary.tracklist.provider;

import com.scholary.tracklist.segment.AudioSegment;

/**
 * Interface for audio-recognition services.
 *
 * <p>One implementation per external service. Implementations make exactly one attempt per call;
 * rate limiting, retries and fallback are the orchestrator's job, so fakes in tests stay trivial.
 */
public interface ProviderClient {

  /**
   * Name used in configuration ({@code providerPriorityOrder}), rate-limiter buckets and results.
   *
   * @return the provider name
   */
  String name();

  /**
   * Identify the track playing in a segment.
   *
   * @param segment the segment to identify
   * @return a match, or a succeeded result without a title when nothing was recognized
   * @throws ProviderException if the attempt failed
   */
  ProviderResult identify(AudioSegment segment);
}
