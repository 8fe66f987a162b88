package com.scholary.tracklist.pipeline;

import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.config.TracklistProperties;
import com.scholary.tracklist.matching.MatcherSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective options for one run: application defaults with request overrides applied.
 *
 * @param acceptanceThreshold confidence at which the orchestrator stops falling back
 */
public record PipelineSettings(
    double segmentLengthSeconds,
    double overlapSeconds,
    double minConfidenceThreshold,
    double acceptanceThreshold,
    double timeThresholdSeconds,
    int maxDuplicates,
    List<String> providerPriorityOrder,
    boolean fallbackEnabled,
    Duration cacheTtl,
    int maxConcurrentSegments) {

  public static final double MIN_SEGMENT_LENGTH_SECONDS = 10;
  public static final double MAX_SEGMENT_LENGTH_SECONDS = 300;

  public PipelineSettings {
    providerPriorityOrder =
        providerPriorityOrder == null ? List.of() : List.copyOf(providerPriorityOrder);
  }

  /** Defaults from application configuration. Not validated yet. */
  public static PipelineSettings from(TracklistProperties properties) {
    double acceptance =
        properties.acceptanceThreshold() != null
            ? properties.acceptanceThreshold()
            : properties.minConfidenceThreshold();
    return new PipelineSettings(
        properties.segmentLengthSeconds(),
        properties.overlapSeconds(),
        properties.minConfidenceThreshold(),
        acceptance,
        properties.timeThresholdSeconds(),
        properties.maxDuplicates(),
        properties.providerPriorityOrder(),
        properties.fallbackEnabled(),
        properties.cacheTtl(),
        properties.maxConcurrentSegments());
  }

  /**
   * Check every option and report all violations at once.
   *
   * @return this, for chaining
   * @throws ConfigurationException if any option is out of range
   */
  public PipelineSettings validate() {
    List<String> violations = new ArrayList<>();
    if (!(segmentLengthSeconds >= MIN_SEGMENT_LENGTH_SECONDS
        && segmentLengthSeconds <= MAX_SEGMENT_LENGTH_SECONDS)) {
      violations.add(
          "segmentLengthSeconds must be between 10 and 300, got " + segmentLengthSeconds);
    }
    if (!(overlapSeconds >= 0 && overlapSeconds < segmentLengthSeconds)) {
      violations.add(
          "overlapSeconds must satisfy 0 <= overlap < segmentLengthSeconds, got "
              + overlapSeconds);
    }
    if (!(minConfidenceThreshold >= 0.0 && minConfidenceThreshold <= 1.0)) {
      violations.add(
          "minConfidenceThreshold must be between 0.0 and 1.0, got " + minConfidenceThreshold);
    }
    if (!(acceptanceThreshold >= 0.0 && acceptanceThreshold <= 1.0)) {
      violations.add(
          "acceptanceThreshold must be between 0.0 and 1.0, got " + acceptanceThreshold);
    }
    if (!(timeThresholdSeconds >= 0)) {
      violations.add("timeThresholdSeconds must be >= 0, got " + timeThresholdSeconds);
    }
    if (maxDuplicates < 0) {
      violations.add("maxDuplicates must be >= 0, got " + maxDuplicates);
    }
    if (providerPriorityOrder.isEmpty()) {
      violations.add("providerPriorityOrder must not be empty");
    }
    if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
      violations.add("cacheTtl must be positive, got " + cacheTtl);
    }
    if (maxConcurrentSegments < 1) {
      violations.add("maxConcurrentSegments must be >= 1, got " + maxConcurrentSegments);
    }
    if (!violations.isEmpty()) {
      throw new ConfigurationException(violations);
    }
    return this;
  }

  public MatcherSettings matcherSettings() {
    return new MatcherSettings(minConfidenceThreshold, timeThresholdSeconds, maxDuplicates);
  }
}
