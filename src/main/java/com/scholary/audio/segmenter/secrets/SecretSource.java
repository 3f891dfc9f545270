package com.scholary.audio.segmenter.secrets;

/**
 * Source of API credentials.
 *
 * <p>Implementations resolve each secret at most once per process and serve later lookups from
 * memory, so clients can ask for their key on every request.
 */
public interface SecretSource {

  /**
   * Look up a secret by name.
   *
   * @param name the secret name, e.g. a parameter store path
   * @return the secret value
   * @throws SecretException if the secret does not exist or cannot be read
   */
  String getSecret(String name);
}
