package com.scholary.tracklist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.provider.ProviderClient;
import com.scholary.tracklist.provider.acrcloud.AcrCloudProperties;
import com.scholary.tracklist.provider.acrcloud.AcrCloudProviderClient;
import com.scholary.tracklist.provider.audd.AuddProperties;
import com.scholary.tracklist.provider.audd.AuddProviderClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the recognition provider clients.
 *
 * <p>Each client is only created when its {@code enabled} flag is set; disabled providers are
 * unknown to the registry.
 */
@Configuration
@EnableConfigurationProperties({AcrCloudProperties.class, AuddProperties.class})
public class ProviderConfig {

  @Bean
  @ConditionalOnProperty(prefix = "providers.acrcloud", name = "enabled", havingValue = "true")
  public ProviderClient acrCloudProviderClient(
      AcrCloudProperties properties, ObjectMapper objectMapper) {
    return new AcrCloudProviderClient(properties, objectMapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "providers.audd", name = "enabled", havingValue = "true")
  public ProviderClient auddProviderClient(AuddProperties properties, ObjectMapper objectMapper) {
    return new AuddProviderClient(properties, objectMapper);
  }
}
