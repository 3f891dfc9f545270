package com.scholary.audio.segmenter.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The SDK has already retried transient failures by the time this is thrown.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
