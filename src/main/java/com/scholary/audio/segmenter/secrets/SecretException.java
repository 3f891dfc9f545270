package com.scholary.audio.segmenter.secrets;

/** Exception thrown when a secret cannot be resolved. */
public class SecretException extends RuntimeException {

  public SecretException(String message) {
    super(message);
  }

  public SecretException(String message, Throwable cause) {
    super(message, cause);
  }
}
