package com.scholary.tracklist.matching;

/**
 * One entry of a tracklist.
 *
 * @param title title as reported by the provider that first named it
 * @param artist artist as reported by the provider that first named it
 * @param confidence highest confidence seen for this entry
 * @param firstSeenOffsetSeconds start of the first segment attributed to this entry
 * @param lastSeenOffsetSeconds start of the last segment attributed to this entry
 * @param sourceProvider provider that produced {@code confidence}
 * @param occurrenceCount segments attributed to this entry, suppressed replays included
 */
public record Track(
    String title,
    String artist,
    double confidence,
    double firstSeenOffsetSeconds,
    double lastSeenOffsetSeconds,
    String sourceProvider,
    int occurrenceCount) {

  public TrackIdentity identity() {
    return TrackIdentity.of(title, artist);
  }
}
