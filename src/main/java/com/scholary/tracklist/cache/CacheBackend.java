package com.scholary.tracklist.cache;

import java.time.Duration;
import java.util.Optional;

/** Byte-level key/value store behind {@link BackendIdentificationCache}. */
public interface CacheBackend {

  /**
   * @throws CacheUnavailableException if the store cannot be reached
   */
  Optional<byte[]> get(String key);

  /**
   * Store a value. Backends may drop it after {@code ttl}; readers still check expiry themselves.
   *
   * @throws CacheUnavailableException if the store cannot be reached
   */
  void put(String key, byte[] value, Duration ttl);
}
