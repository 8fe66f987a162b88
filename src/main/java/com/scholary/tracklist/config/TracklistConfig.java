package com.scholary.tracklist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.cache.BackendIdentificationCache;
import com.scholary.tracklist.cache.CacheBackend;
import com.scholary.tracklist.cache.CaffeineCacheBackend;
import com.scholary.tracklist.cache.IdentificationCache;
import com.scholary.tracklist.cache.NoOpIdentificationCache;
import com.scholary.tracklist.cache.ObjectStoreCacheBackend;
import com.scholary.tracklist.identify.CircuitBreakerProperties;
import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.provider.ProviderClient;
import com.scholary.tracklist.provider.ProviderRegistry;
import com.scholary.tracklist.ratelimit.RateLimiter;
import com.scholary.tracklist.retry.RetryPolicy;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the shared identification resources.
 *
 * <p>Rate limiter, cache and retry policy are singletons shared by every run, so concurrent jobs
 * against the same provider draw from the same token bucket.
 */
@Configuration
@EnableConfigurationProperties(TracklistProperties.class)
public class TracklistConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(TracklistConfig.class);

  @Bean
  public RetryPolicy retryPolicy(TracklistProperties properties) {
    return new RetryPolicy(properties.retry());
  }

  @Bean
  public RateLimiter rateLimiter(TracklistProperties properties) {
    return new RateLimiter(properties.ratelimit());
  }

  @Bean
  public CircuitBreakerProperties circuitBreakerProperties(TracklistProperties properties) {
    return properties.circuitBreaker();
  }

  @Bean
  public IdentificationCache identificationCache(
      TracklistProperties properties,
      ObjectMapper objectMapper,
      ObjectProvider<ObjectStoreClient> objectStoreClient) {
    TracklistProperties.CacheProperties cache = properties.cache();
    if (!cache.enabled()) {
      LOGGER.info("Identification cache disabled");
      return new NoOpIdentificationCache();
    }
    CacheBackend backend =
        switch (cache.backend()) {
          case MEMORY -> new CaffeineCacheBackend(cache.maxSize());
          case OBJECTSTORE -> {
            if (cache.bucket() == null || cache.bucket().isBlank()) {
              throw new ConfigurationException(
                  "tracklist.cache.bucket is required for the objectstore cache backend");
            }
            yield new ObjectStoreCacheBackend(
                objectStoreClient.getObject(), cache.bucket(), cache.prefix());
          }
        };
    return new BackendIdentificationCache(backend, objectMapper, Clock.systemUTC());
  }

  @Bean
  public ProviderRegistry providerRegistry(ObjectProvider<ProviderClient> providerClients) {
    ProviderRegistry registry = new ProviderRegistry(providerClients.orderedStream().toList());
    LOGGER.info("Registered recognition providers: {}", registry.names());
    return registry;
  }
}
