package com.scholary.audio.segmenter.whisper;

/**
 * Exception thrown when a speech-to-text call fails.
 *
 * <p>Carries the HTTP status of the failed call so callers can tell permanent failures from
 * transient ones. Transport and parse failures have no status and report {@link
 * #NO_STATUS}. Rate-limited calls may carry the service's hint for when the limit resets.
 */
public class WhisperException extends RuntimeException {

  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final Long rateLimitResetMs;

  public WhisperException(String message) {
    this(message, NO_STATUS, null, null);
  }

  public WhisperException(String message, Throwable cause) {
    this(message, NO_STATUS, null, cause);
  }

  public WhisperException(String message, int statusCode, Long rateLimitResetMs) {
    this(message, statusCode, rateLimitResetMs, null);
  }

  private WhisperException(
      String message, int statusCode, Long rateLimitResetMs, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.rateLimitResetMs = rateLimitResetMs;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** Reset hint in milliseconds, or null if the service sent none. */
  public Long getRateLimitResetMs() {
    return rateLimitResetMs;
  }
}
