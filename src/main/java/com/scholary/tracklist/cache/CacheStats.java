package com.scholary.tracklist.cache;

/** Counters since startup. {@code errors} counts reads and writes the store refused. */
public record CacheStats(long hits, long misses, long writes, long errors) {

  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
