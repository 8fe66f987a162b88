package com.scholary.tracklist;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.tracklist.cache.BackendIdentificationCache;
import com.scholary.tracklist.cache.IdentificationCache;
import com.scholary.tracklist.provider.ProviderRegistry;
import com.scholary.tracklist.ratelimit.RateLimiter;
import com.scholary.tracklist.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class TracklistApplicationTest {

  @Autowired private ProviderRegistry providerRegistry;
  @Autowired private IdentificationCache identificationCache;
  @Autowired private RateLimiter rateLimiter;
  @Autowired private RetryPolicy retryPolicy;

  @Test
  void contextLoads_shouldWireDefaultConfiguration() {
    assertThat(providerRegistry.names()).containsExactlyInAnyOrder("acrcloud", "audd");
    assertThat(identificationCache).isInstanceOf(BackendIdentificationCache.class);
    assertThat(rateLimiter.isEnabled()).isTrue();
    assertThat(retryPolicy.maxAttempts()).isEqualTo(3);
  }
}
