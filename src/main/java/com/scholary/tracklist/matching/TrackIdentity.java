package com.scholary.tracklist.matching;

import java.util.Locale;

/**
 * Normalized (title, artist) pair. Two results name the same track when their identities are
 * equal: comparison ignores case and runs of whitespace.
 */
public record TrackIdentity(String title, String artist) {

  public static TrackIdentity of(String title, String artist) {
    return new TrackIdentity(normalize(title), normalize(artist));
  }

  static String normalize(String value) {
    if (value == null) {
      return "";
    }
    return value.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return artist + " - " + title;
  }
}
