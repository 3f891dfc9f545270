package com.scholary.audio.segmenter.transcription;

import com.scholary.audio.segmenter.whisper.WhisperException;
import java.time.Duration;
import java.util.Set;

/**
 * Decides whether a failed transcription call is retried and how long to wait first.
 *
 * <p>Classification is by HTTP status:
 *
 * <ul>
 *   <li>400, 401, 403, 413: {@link FailureClass#PERMANENT}, the same bytes will fail again
 *   <li>429: {@link FailureClass#RATE_LIMITED}
 *   <li>anything else, including transport errors: {@link FailureClass#TRANSIENT}
 * </ul>
 *
 * <p>Backoff for rate limiting uses the service's reset hint when it sent one, otherwise a fixed
 * delay. Other transient failures back off exponentially: {@code 2^attempt * base}, with the
 * first retry at attempt 0.
 */
public class RetryPolicy {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final long DEFAULT_RATE_LIMIT_FALLBACK_MS = 2000;
  public static final long DEFAULT_BASE_BACKOFF_MS = 1000;

  private static final Set<Integer> PERMANENT_STATUSES = Set.of(400, 401, 403, 413);
  private static final int RATE_LIMITED_STATUS = 429;

  private final int maxRetries;
  private final long rateLimitFallbackMs;
  private final long baseBackoffMs;

  public RetryPolicy(int maxRetries, long rateLimitFallbackMs, long baseBackoffMs) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("Max retries cannot be negative");
    }
    this.maxRetries = maxRetries;
    this.rateLimitFallbackMs = rateLimitFallbackMs;
    this.baseBackoffMs = baseBackoffMs;
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(
        DEFAULT_MAX_RETRIES, DEFAULT_RATE_LIMIT_FALLBACK_MS, DEFAULT_BASE_BACKOFF_MS);
  }

  public FailureClass classify(WhisperException failure) {
    int status = failure.getStatusCode();
    if (PERMANENT_STATUSES.contains(status)) {
      return FailureClass.PERMANENT;
    }
    if (status == RATE_LIMITED_STATUS) {
      return FailureClass.RATE_LIMITED;
    }
    return FailureClass.TRANSIENT;
  }

  /**
   * Whether another attempt should be made.
   *
   * @param failure the failure of the latest attempt
   * @param retriesSoFar retries already made for this chunk (0 after the first attempt)
   */
  public boolean shouldRetry(WhisperException failure, int retriesSoFar) {
    return classify(failure) != FailureClass.PERMANENT && retriesSoFar < maxRetries;
  }

  /**
   * Delay before the next attempt.
   *
   * @param failure the failure of the latest attempt
   * @param retriesSoFar retries already made for this chunk (0 after the first attempt)
   */
  public Duration backoff(WhisperException failure, int retriesSoFar) {
    if (classify(failure) == FailureClass.RATE_LIMITED) {
      Long hint = failure.getRateLimitResetMs();
      return Duration.ofMillis(hint != null && hint >= 0 ? hint : rateLimitFallbackMs);
    }
    return Duration.ofMillis((1L << retriesSoFar) * baseBackoffMs);
  }

  public int maxRetries() {
    return maxRetries;
  }
}
