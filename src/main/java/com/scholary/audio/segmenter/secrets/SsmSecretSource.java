package com.scholary.audio.segmenter.secrets;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.SsmException;

/**
 * Secret source backed by AWS Systems Manager Parameter Store.
 *
 * <p>Parameters are read with decryption, so SecureString values come back in plain text. Each
 * value is cached for the lifetime of the process: the first lookup of a name goes to SSM, every
 * later one is served from memory. Concurrent first lookups of the same name result in a single
 * SSM call.
 *
 * <p>Owns the SSM client and closes it on {@link #close()}.
 */
public class SsmSecretSource implements SecretSource, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SsmSecretSource.class);

  private final SsmClient ssmClient;
  private final Cache<String, String> cache;

  public SsmSecretSource(SsmClient ssmClient) {
    this.ssmClient = ssmClient;
    this.cache = Caffeine.newBuilder().build();
  }

  @Override
  public String getSecret(String name) {
    return cache.get(name, this::fetch);
  }

  private String fetch(String name) {
    LOGGER.info("Resolving secret from SSM: name={}", name);

    try {
      GetParameterRequest request =
          GetParameterRequest.builder().name(name).withDecryption(true).build();
      GetParameterResponse response = ssmClient.getParameter(request);

      String value = response.parameter().value();
      if (value == null || value.isBlank()) {
        throw new SecretException("Secret is empty: " + name);
      }

      LOGGER.info("Secret resolved and cached: name={}", name);
      return value;

    } catch (ParameterNotFoundException e) {
      String message = String.format("Secret not found: name=%s", name);
      LOGGER.error(message);
      throw new SecretException(message, e);

    } catch (SsmException e) {
      String message =
          String.format("Failed to resolve secret: name=%s, statusCode=%s", name, e.statusCode());
      LOGGER.error(message, e);
      throw new SecretException(message, e);
    }
  }

  @Override
  public void close() {
    ssmClient.close();
  }
}
