package com.scholary.dubber.config;

import com.scholary.dubber.objectstore.ObjectStoreClient;
import com.scholary.dubber.objectstore.ObjectStoreProperties;
import com.scholary.dubber.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires up the ObjectStoreClient bean using properties from application.yml. The client is
 * closed when the context shuts down.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
