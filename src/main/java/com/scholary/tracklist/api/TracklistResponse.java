package com.scholary.tracklist.api;

import com.scholary.tracklist.matching.Track;
import com.scholary.tracklist.pipeline.PipelineDiagnostics;
import java.util.List;

/**
 * Identified tracklist of a mix.
 *
 * @param partial true when the run was cancelled or ran out of time before the end of the mix
 */
public record TracklistResponse(
    String jobId,
    String sourceId,
    List<TrackEntry> tracks,
    boolean partial,
    PipelineDiagnostics diagnostics) {

  /** A track with its 1-based position in the tracklist. */
  public record TrackEntry(
      int position,
      String title,
      String artist,
      double confidence,
      double firstSeenOffsetSeconds,
      double lastSeenOffsetSeconds,
      String sourceProvider,
      int occurrenceCount) {

    public static TrackEntry of(int position, Track track) {
      return new TrackEntry(
          position,
          track.title(),
          track.artist(),
          track.confidence(),
          track.firstSeenOffsetSeconds(),
          track.lastSeenOffsetSeconds(),
          track.sourceProvider(),
          track.occurrenceCount());
    }
  }
}
