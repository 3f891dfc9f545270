package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.objectstore.ObjectStoreClient;
import com.scholary.audio.segmenter.objectstore.ObjectStoreProperties;
import com.scholary.audio.segmenter.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the ObjectStoreClient bean from the objectstore.* properties. */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
