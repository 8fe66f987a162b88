package com.scholary.tracklist.config;

import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.objectstore.ObjectStoreProperties;
import com.scholary.tracklist.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Mixes are read from here; the identification cache can be persisted here too.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
