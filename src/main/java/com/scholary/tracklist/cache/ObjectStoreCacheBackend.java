package com.scholary.tracklist.cache;

import com.scholary.tracklist.objectstore.ObjectNotFoundException;
import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.objectstore.ObjectStoreException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists cache entries as JSON objects under a key prefix, so they survive restarts and are
 * shared between instances.
 *
 * <p>Objects are never deleted here; expiry is checked on read. Use a bucket lifecycle rule to
 * reclaim space.
 */
public class ObjectStoreCacheBackend implements CacheBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreCacheBackend.class);

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final String prefix;

  public ObjectStoreCacheBackend(
      ObjectStoreClient objectStoreClient, String bucket, String prefix) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
    if (prefix == null || prefix.isEmpty()) {
      this.prefix = "";
    } else {
      this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }
    LOGGER.info(
        "Initialized object store identification cache: bucket={}, prefix={}", bucket, prefix);
  }

  @Override
  public Optional<byte[]> get(String key) {
    try {
      return Optional.of(objectStoreClient.readObject(bucket, objectKey(key)));
    } catch (ObjectNotFoundException e) {
      return Optional.empty();
    } catch (ObjectStoreException e) {
      throw new CacheUnavailableException("Failed to read cache entry " + key, e);
    }
  }

  @Override
  public void put(String key, byte[] value, Duration ttl) {
    try {
      objectStoreClient.writeObject(bucket, objectKey(key), value, "application/json");
    } catch (ObjectStoreException e) {
      throw new CacheUnavailableException("Failed to write cache entry " + key, e);
    }
  }

  String objectKey(String key) {
    return prefix + key + ".json";
  }
}
