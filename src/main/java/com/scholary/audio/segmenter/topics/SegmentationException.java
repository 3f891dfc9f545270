package com.scholary.audio.segmenter.topics;

/**
 * Exception thrown when topic segmentation fails.
 *
 * <p>Covers transport errors, error responses and responses that do not contain a usable segment
 * list. Whether it fails the job depends on the segmentation fallback setting.
 */
public class SegmentationException extends RuntimeException {

  public SegmentationException(String message) {
    super(message);
  }

  public SegmentationException(String message, Throwable cause) {
    super(message, cause);
  }
}
