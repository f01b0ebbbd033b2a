package com.scholary.subtitle.config;

import com.scholary.subtitle.storage.ObjectStoreClient;
import com.scholary.subtitle.storage.ObjectStoreProperties;
import com.scholary.subtitle.storage.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>The client is only created when {@code objectstore.enabled} is true. Without it, only local
 * paths are accepted as inputs and destinations.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
