package com.scholary.tracklist.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory backend using Caffeine.
 *
 * <p>Each entry expires after its own ttl. Size is bounded; the least useful entries go first
 * when the limit is reached.
 */
public class CaffeineCacheBackend implements CacheBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineCacheBackend.class);

  private final Cache<String, StoredValue> cache;

  public CaffeineCacheBackend(long maxSize) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryTtl())
            .build();
    LOGGER.info("Initialized in-memory identification cache: maxSize={}", maxSize);
  }

  @Override
  public Optional<byte[]> get(String key) {
    StoredValue stored = cache.getIfPresent(key);
    return stored == null ? Optional.empty() : Optional.of(stored.bytes());
  }

  @Override
  public void put(String key, byte[] value, Duration ttl) {
    cache.put(key, new StoredValue(value, ttl));
  }

  private record StoredValue(byte[] bytes, Duration ttl) {}

  private static final class PerEntryTtl implements Expiry<String, StoredValue> {

    @Override
    public long expireAfterCreate(String key, StoredValue value, long currentTime) {
      return saturatedNanos(value.ttl());
    }

    @Override
    public long expireAfterUpdate(
        String key, StoredValue value, long currentTime, long currentDuration) {
      return saturatedNanos(value.ttl());
    }

    @Override
    public long expireAfterRead(
        String key, StoredValue value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private static long saturatedNanos(Duration ttl) {
      try {
        return ttl.toNanos();
      } catch (ArithmeticException e) {
        return Long.MAX_VALUE;
      }
    }
  }
}
