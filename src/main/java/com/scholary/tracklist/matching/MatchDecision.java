package com.scholary.tracklist.matching;

/** What {@link TrackMatcher#consume} did with a segment. */
public enum MatchDecision {
  /** No usable result: failed, no match, or below the confidence threshold. */
  REJECTED,
  /** Extended the most recently accepted track. */
  CONTINUED,
  /** Extended an earlier entry of the same track that was still within the time threshold. */
  MERGED,
  /** Appended a new entry for a track heard before. */
  REPLAYED,
  /** Appended the first entry for a track. */
  NEW,
  /** A replay beyond the duplicate limit; only the occurrence count changed. */
  SUPPRESSED;

  public boolean appended() {
    return this == NEW || this == REPLAYED;
  }
}
