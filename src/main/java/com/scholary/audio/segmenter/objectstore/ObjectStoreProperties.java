package com.scholary.audio.segmenter.objectstore;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for object storage, bound from {@code objectstore.*}.
 *
 * <p>Leave {@code endpoint} empty for AWS S3. When {@code accessKey} is empty the SDK default
 * credentials chain is used (environment, profile, instance or task role).
 */
@ConfigurationProperties(prefix = "objectstore")
public record ObjectStoreProperties(
    String endpoint, String accessKey, String secretKey, String region, boolean pathStyleAccess) {

  public boolean hasEndpoint() {
    return endpoint != null && !endpoint.isBlank();
  }

  public boolean hasStaticCredentials() {
    return accessKey != null && !accessKey.isBlank();
  }
}
