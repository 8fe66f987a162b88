package com.scholary.tracklist.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.provider.ProviderResult;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdentificationCache} that stores JSON-serialized {@link CacheEntry} values in a {@link
 * CacheBackend}.
 *
 * <p>Expiry is checked against the injected clock on every read, whatever the backend does with
 * the ttl. A backend that is down, or an entry that no longer parses, counts as a miss.
 */
public class BackendIdentificationCache implements IdentificationCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendIdentificationCache.class);

  private final CacheBackend backend;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder writes = new LongAdder();
  private final LongAdder errors = new LongAdder();

  public BackendIdentificationCache(CacheBackend backend, ObjectMapper objectMapper, Clock clock) {
    this.backend = backend;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public Optional<CacheEntry> get(String fingerprint) {
    Optional<byte[]> bytes;
    try {
      bytes = backend.get(fingerprint);
    } catch (CacheUnavailableException e) {
      errors.increment();
      misses.increment();
      LOGGER.warn("Cache read failed, treating as miss: {}", e.getMessage());
      return Optional.empty();
    }
    if (bytes.isEmpty()) {
      misses.increment();
      return Optional.empty();
    }

    CacheEntry entry;
    try {
      entry = objectMapper.readValue(bytes.get(), CacheEntry.class);
    } catch (IOException e) {
      errors.increment();
      misses.increment();
      LOGGER.warn("Discarding unreadable cache entry {}: {}", fingerprint, e.getMessage());
      return Optional.empty();
    }

    if (entry.isExpired(clock.instant())) {
      misses.increment();
      LOGGER.debug("Cache entry expired: {}", fingerprint);
      return Optional.empty();
    }
    hits.increment();
    return Optional.of(entry);
  }

  @Override
  public void put(String fingerprint, List<ProviderResult> results, Duration ttl) {
    Instant now = clock.instant();
    CacheEntry entry = new CacheEntry(fingerprint, results, now, ttl);
    try {
      backend.put(fingerprint, objectMapper.writeValueAsBytes(entry), ttl);
      writes.increment();
    } catch (JsonProcessingException e) {
      errors.increment();
      LOGGER.warn("Could not serialize cache entry {}: {}", fingerprint, e.getMessage());
    } catch (CacheUnavailableException e) {
      errors.increment();
      LOGGER.warn("Cache write failed, skipping: {}", e.getMessage());
    }
  }

  @Override
  public CacheStats stats() {
    return new CacheStats(hits.sum(), misses.sum(), writes.sum(), errors.sum());
  }
}
