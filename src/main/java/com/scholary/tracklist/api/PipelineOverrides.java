package com.scholary.tracklist.api;

import com.scholary.tracklist.pipeline.PipelineSettings;
import java.time.Duration;
import java.util.List;

/**
 * Per-request overrides of the configured pipeline defaults. Null fields keep the default.
 *
 * <p>Ranges are checked by {@link PipelineSettings#validate()} after merging, so all violations
 * are reported together.
 */
public record PipelineOverrides(
    Double segmentLengthSeconds,
    Double overlapSeconds,
    Double minConfidenceThreshold,
    Double acceptanceThreshold,
    Double timeThresholdSeconds,
    Integer maxDuplicates,
    List<String> providerPriorityOrder,
    Boolean fallbackEnabled,
    Long cacheTtlSeconds,
    Integer maxConcurrentSegments) {

  public PipelineSettings applyTo(PipelineSettings defaults) {
    return new PipelineSettings(
        segmentLengthSeconds != null ? segmentLengthSeconds : defaults.segmentLengthSeconds(),
        overlapSeconds != null ? overlapSeconds : defaults.overlapSeconds(),
        minConfidenceThreshold != null
            ? minConfidenceThreshold
            : defaults.minConfidenceThreshold(),
        acceptanceThreshold != null ? acceptanceThreshold : defaults.acceptanceThreshold(),
        timeThresholdSeconds != null ? timeThresholdSeconds : defaults.timeThresholdSeconds(),
        maxDuplicates != null ? maxDuplicates : defaults.maxDuplicates(),
        providerPriorityOrder != null ? providerPriorityOrder : defaults.providerPriorityOrder(),
        fallbackEnabled != null ? fallbackEnabled : defaults.fallbackEnabled(),
        cacheTtlSeconds != null ? Duration.ofSeconds(cacheTtlSeconds) : defaults.cacheTtl(),
        maxConcurrentSegments != null ? maxConcurrentSegments : defaults.maxConcurrentSegments());
  }
}
