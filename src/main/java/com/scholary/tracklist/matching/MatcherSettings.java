package com.scholary.tracklist.matching;

/**
 * @param minConfidenceThreshold results below this never produce or extend a track
 * @param timeThresholdSeconds max gap between sightings that still counts as the same play
 * @param maxDuplicates max entries one track may produce in a tracklist
 */
public record MatcherSettings(
    double minConfidenceThreshold, double timeThresholdSeconds, int maxDuplicates) {}
