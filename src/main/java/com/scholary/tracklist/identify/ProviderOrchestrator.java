package com.scholary.tracklist.identify;

import com.scholary.tracklist.cache.CacheEntry;
import com.scholary.tracklist.cache.IdentificationCache;
import com.scholary.tracklist.cache.SegmentFingerprint;
import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.provider.ErrorKind;
import com.scholary.tracklist.provider.ProviderClient;
import com.scholary.tracklist.provider.ProviderException;
import com.scholary.tracklist.provider.ProviderResult;
import com.scholary.tracklist.ratelimit.RateLimiter;
import com.scholary.tracklist.retry.RetryPolicy;
import com.scholary.tracklist.segment.AudioSegment;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identifies one segment against the configured providers.
 *
 * <p>Order of operations per segment:
 *
 * <ol>
 *   <li>Return the cached results if the segment's fingerprint has a live cache entry.
 *   <li>Call providers in priority order. A provider whose {@link CircuitBreaker} is open is
 *       skipped. Each call takes a rate limiter permit first; transient failures are retried as
 *       the {@link RetryPolicy} says.
 *   <li>Move to the next provider (when fallback is enabled) if the current one failed or its
 *       answer is below the acceptance threshold. Stop at the first accepted answer.
 *   <li>Cache every result obtained, failures included, and return them best first. Segments
 *       that got no answer because providers were skipped are not cached.
 * </ol>
 *
 * <p>Circuit breakers live as long as the orchestrator, i.e. one run.
 *
 * <p>Provider failures never escape {@link #identify}; a segment nobody could identify comes back
 * as failed, zero-confidence results. Providers for one segment are called sequentially;
 * different segments may be identified concurrently.
 */
public class ProviderOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final Comparator<ProviderResult> RANKING =
      Comparator.comparing(ProviderResult::succeeded, Comparator.reverseOrder())
          .thenComparing(ProviderResult::confidence, Comparator.reverseOrder());

  private final List<ProviderClient> providers;
  private final IdentificationCache cache;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final double acceptanceThreshold;
  private final boolean fallbackEnabled;
  private final Duration cacheTtl;
  private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();

  private final LongAdder cacheHits = new LongAdder();
  private final LongAdder providerCalls = new LongAdder();
  private final LongAdder exhaustedSegments = new LongAdder();
  private final Map<String, LongAdder> callsByProvider = new LinkedHashMap<>();

  public ProviderOrchestrator(
      List<ProviderClient> providers,
      IdentificationCache cache,
      RateLimiter rateLimiter,
      RetryPolicy retryPolicy,
      double acceptanceThreshold,
      boolean fallbackEnabled,
      Duration cacheTtl,
      CircuitBreakerProperties circuitBreaker,
      Clock clock) {
    if (providers.isEmpty()) {
      throw new ConfigurationException("At least one provider is required");
    }
    this.providers = List.copyOf(providers);
    this.cache = cache;
    this.rateLimiter = rateLimiter;
    this.retryPolicy = retryPolicy;
    this.acceptanceThreshold = acceptanceThreshold;
    this.fallbackEnabled = fallbackEnabled;
    this.cacheTtl = cacheTtl;
    // Populated up front so concurrent identify() calls only read the map.
    for (ProviderClient provider : this.providers) {
      callsByProvider.put(provider.name(), new LongAdder());
      breakers.put(provider.name(), new CircuitBreaker(provider.name(), circuitBreaker, clock));
    }
  }

  /**
   * Identify a segment.
   *
   * @param segment the segment
   * @return every result obtained for the segment, best first; never empty
   */
  public List<ProviderResult> identify(AudioSegment segment) {
    String fingerprint = SegmentFingerprint.of(segment);
    Optional<CacheEntry> cached = cache.get(fingerprint);
    if (cached.isPresent() && !cached.get().results().isEmpty()) {
      cacheHits.increment();
      STRUCTURED_LOGGER.logCacheHit(segment.index(), fingerprint);
      return cached.get().results();
    }

    List<ProviderResult> results = new ArrayList<>();
    boolean skipped = false;
    for (int i = 0; i < providers.size(); i++) {
      ProviderClient provider = providers.get(i);
      CircuitBreaker breaker = breakers.get(provider.name());
      ProviderResult result;
      if (breaker.tryAcquire()) {
        result = callWithRetry(provider, segment);
        recordOutcome(breaker, result);
      } else {
        skipped = true;
        LOGGER.debug("Circuit open, skipping {} for segment {}", provider.name(), segment.index());
        result =
            ProviderResult.failed(
                provider.name(),
                breaker.lastFailure(),
                segment.startOffsetSeconds(),
                "Circuit open, provider skipped");
      }
      results.add(result);

      if (Thread.currentThread().isInterrupted() || isAccepted(result) || !fallbackEnabled) {
        break;
      }
      if (i + 1 < providers.size()) {
        STRUCTURED_LOGGER.logProviderFallback(
            segment.index(),
            provider.name(),
            providers.get(i + 1).name(),
            describe(result));
      }
    }

    List<ProviderResult> ranked = new ArrayList<>(results);
    ranked.sort(RANKING);
    List<ProviderResult> ordered = List.copyOf(ranked);

    boolean anySucceeded = ordered.stream().anyMatch(ProviderResult::succeeded);
    if (!anySucceeded) {
      exhaustedSegments.increment();
    }
    if (Thread.currentThread().isInterrupted()) {
      LOGGER.debug("Segment {} interrupted, not caching partial results", segment.index());
    } else if (skipped && !anySucceeded) {
      LOGGER.debug("Segment {} unanswered with providers skipped, not caching", segment.index());
    } else {
      cache.put(fingerprint, ordered, cacheTtl);
    }
    return ordered;
  }

  public OrchestratorStats stats() {
    Map<String, Long> byName = new LinkedHashMap<>();
    callsByProvider.forEach((name, count) -> byName.put(name, count.sum()));
    Map<String, Long> trips = new LinkedHashMap<>();
    breakers.forEach((name, breaker) -> trips.put(name, breaker.trips()));
    return new OrchestratorStats(
        cacheHits.sum(), providerCalls.sum(), exhaustedSegments.sum(), byName, trips);
  }

  /** Breaker of the named provider, for inspection. */
  CircuitBreaker circuitBreaker(String provider) {
    return breakers.get(provider);
  }

  private static void recordOutcome(CircuitBreaker breaker, ProviderResult result) {
    if (Thread.currentThread().isInterrupted()) {
      breaker.recordAbandoned();
    } else if (result.succeeded()) {
      breaker.recordSuccess();
    } else {
      breaker.recordFailure(result.errorKind());
    }
  }

  private boolean isAccepted(ProviderResult result) {
    return result.hasMatch() && result.confidence() >= acceptanceThreshold;
  }

  private ProviderResult callWithRetry(ProviderClient provider, AudioSegment segment) {
    double offset = segment.startOffsetSeconds();
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        rateLimiter.acquire(provider.name());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return ProviderResult.failed(
            provider.name(), ErrorKind.UNKNOWN, offset, "Interrupted waiting for rate limit");
      }

      providerCalls.increment();
      callsByProvider.get(provider.name()).increment();
      long start = System.currentTimeMillis();

      ProviderException failure;
      try {
        ProviderResult result = provider.identify(segment);
        STRUCTURED_LOGGER.logSegmentIdentified(
            segment.index(),
            provider.name(),
            result.trackTitle(),
            result.artist(),
            result.confidence(),
            System.currentTimeMillis() - start);
        return result;
      } catch (ProviderException e) {
        failure = e;
      } catch (RuntimeException e) {
        failure =
            new ProviderException(
                provider.name(), ErrorKind.UNKNOWN, "Unexpected provider error: " + e, e);
      }

      ErrorKind kind = failure.getKind();
      Optional<Duration> delay = retryPolicy.nextDelay(attempt, kind, failure.getRetryAfter());
      if (delay.isEmpty()) {
        STRUCTURED_LOGGER.logProviderFailed(
            segment.index(), provider.name(), attempt, kind.name(), failure.getMessage());
        return ProviderResult.failed(provider.name(), kind, offset, failure.getMessage());
      }

      STRUCTURED_LOGGER.logProviderRetry(
          segment.index(),
          provider.name(),
          attempt,
          retryPolicy.maxAttempts(),
          kind.name(),
          delay.get().toMillis(),
          failure.getMessage());
      try {
        Thread.sleep(delay.get().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return ProviderResult.failed(
            provider.name(), kind, offset, "Interrupted before retry: " + failure.getMessage());
      }
    }
  }

  private static String describe(ProviderResult result) {
    if (!result.succeeded()) {
      return "failed (" + result.errorKind() + ")";
    }
    return result.hasMatch() ? "low confidence " + result.confidence() : "no match";
  }
}
