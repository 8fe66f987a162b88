package com.scholary.tracklist.config;

import com.scholary.tracklist.identify.CircuitBreakerProperties;
import com.scholary.tracklist.ratelimit.RateLimitProperties;
import com.scholary.tracklist.retry.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for tracklist identification.
 *
 * <p>Pipeline defaults that requests may override, plus shared resources: retry, rate limiting,
 * circuit breaking, the result cache and executor sizing.
 */
@ConfigurationProperties(prefix = "tracklist")
@Validated
public record TracklistProperties(
    @DecimalMin("10") @DecimalMax("300") double segmentLengthSeconds,
    @PositiveOrZero double overlapSeconds,
    @DecimalMin("0.0") @DecimalMax("1.0") double minConfidenceThreshold,
    @DecimalMin("0.0") @DecimalMax("1.0") Double acceptanceThreshold,
    @PositiveOrZero double timeThresholdSeconds,
    @PositiveOrZero int maxDuplicates,
    @NotEmpty List<String> providerPriorityOrder,
    boolean fallbackEnabled,
    @NotNull Duration cacheTtl,
    @Positive int maxConcurrentSegments,
    @Positive int segmentExecutorThreads,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Valid @NotNull RetryProperties retry,
    @Valid @NotNull RateLimitProperties ratelimit,
    @Valid @NotNull CircuitBreakerProperties circuitBreaker,
    @Valid @NotNull CacheProperties cache) {

  /**
   * @param enabled false swaps in a cache that never hits
   * @param backend where entries live
   * @param maxSize entry limit of the in-memory backend
   * @param bucket bucket of the object store backend
   * @param prefix key prefix of the object store backend
   */
  public record CacheProperties(
      boolean enabled,
      @NotNull Backend backend,
      @Positive long maxSize,
      String bucket,
      String prefix) {

    public enum Backend {
      MEMORY,
      OBJECTSTORE
    }
  }
}
