package com.scholary.audio.segmenter.secrets;

import jakarta.validation.constraints.NotNull;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for secret resolution.
 *
 * <p>{@code SSM} reads AWS Systems Manager Parameter Store in {@code region}. {@code STATIC} serves
 * {@code values} straight from configuration and is meant for local runs.
 */
@ConfigurationProperties(prefix = "secrets")
@Validated
public record SecretsProperties(@NotNull Provider provider, String region, Map<String, String> values) {

  public SecretsProperties {
    if (values == null) {
      values = Map.of();
    }
  }

  public enum Provider {
    SSM,
    STATIC
  }
}
