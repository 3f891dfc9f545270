package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.secrets.SecretSource;
import com.scholary.audio.segmenter.secrets.SecretsProperties;
import com.scholary.audio.segmenter.secrets.SsmSecretSource;
import com.scholary.audio.segmenter.secrets.StaticSecretSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;

/**
 * Configuration for secret resolution.
 *
 * <p>Picks the SecretSource implementation from {@code secrets.provider}. The SSM source is closed
 * on shutdown, together with its client.
 */
@Configuration
@EnableConfigurationProperties(SecretsProperties.class)
public class SecretsConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(SecretsConfig.class);

  // Destroy method is inferred from the instance: only the SSM source has close().
  @Bean
  public SecretSource secretSource(SecretsProperties properties) {
    LOGGER.info("Using secret provider: {}", properties.provider());
    if (properties.provider() == SecretsProperties.Provider.STATIC) {
      return new StaticSecretSource(properties.values());
    }

    SsmClientBuilder builder = SsmClient.builder();
    if (properties.region() != null && !properties.region().isBlank()) {
      builder.region(Region.of(properties.region()));
    }
    return new SsmSecretSource(builder.build());
  }
}
