package com.scholary.tracklist.matching;

import java.util.List;

/** Tracks ordered by {@code firstSeenOffsetSeconds}. */
public record Tracklist(List<Track> tracks) {

  public Tracklist {
    tracks = List.copyOf(tracks);
  }

  public static Tracklist empty() {
    return new Tracklist(List.of());
  }

  public int size() {
    return tracks.size();
  }

  public boolean isEmpty() {
    return tracks.isEmpty();
  }
}
