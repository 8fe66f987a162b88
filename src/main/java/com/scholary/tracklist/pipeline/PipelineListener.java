package com.scholary.tracklist.pipeline;

import com.scholary.tracklist.matching.MatchDecision;

/** Progress callbacks, invoked on the consolidating thread in segment order. */
public interface PipelineListener {

  PipelineListener NONE = new PipelineListener() {};

  default void onStarted(String sourceId, int totalSegments) {}

  default void onSegmentDelivered(
      int segmentIndex, int delivered, int total, MatchDecision decision) {}
}
