package com.scholary.audio.segmenter.objectstore;

import java.io.InputStream;
import java.util.Map;

/**
 * Abstraction for object storage operations.
 *
 * <p>Audio comes in through {@link #getObjectStream} and transcript documents go out through
 * {@link #putObject}. Implementations exist for S3 and S3-compatible services such as MinIO.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream.
   *
   * <p>The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream, with user metadata.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @param metadata user metadata stored alongside the object, may be empty
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket,
      String key,
      InputStream data,
      long contentLength,
      String contentType,
      Map<String, String> metadata);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType, Map<String, String> userMetadata) {

    public ObjectMetadata {
      userMetadata = userMetadata == null ? Map.of() : Map.copyOf(userMetadata);
    }
  }
}
