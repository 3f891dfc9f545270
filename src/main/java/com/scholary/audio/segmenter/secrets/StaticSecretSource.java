package com.scholary.audio.segmenter.secrets;

import java.util.Map;

/** Secret source backed by a fixed map, typically bound from configuration. */
public class StaticSecretSource implements SecretSource {

  private final Map<String, String> secrets;

  public StaticSecretSource(Map<String, String> secrets) {
    this.secrets = Map.copyOf(secrets);
  }

  @Override
  public String getSecret(String name) {
    String value = secrets.get(name);
    if (value == null || value.isBlank()) {
      throw new SecretException("Secret not configured: " + name);
    }
    return value;
  }
}
