package com.scholary.audio.segmenter.transcription;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audio.segmenter.whisper.WhisperException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RetryPolicyTest {

  private final RetryPolicy policy = RetryPolicy.defaults();

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 403, 413})
  void classify_shouldTreatClientErrorsAsPermanent(int status) {
    WhisperException failure = new WhisperException("rejected", status, null);

    assertThat(policy.classify(failure)).isEqualTo(FailureClass.PERMANENT);
    assertThat(policy.shouldRetry(failure, 0)).isFalse();
  }

  @Test
  void classify_shouldTreat429AsRateLimited() {
    assertThat(policy.classify(new WhisperException("slow down", 429, null)))
        .isEqualTo(FailureClass.RATE_LIMITED);
  }

  @ParameterizedTest
  @ValueSource(ints = {404, 500, 502, 503})
  void classify_shouldTreatOtherStatusesAsTransient(int status) {
    assertThat(policy.classify(new WhisperException("boom", status, null)))
        .isEqualTo(FailureClass.TRANSIENT);
  }

  @Test
  void classify_shouldTreatTransportFailuresAsTransient() {
    assertThat(policy.classify(new WhisperException("connection reset")))
        .isEqualTo(FailureClass.TRANSIENT);
  }

  @Test
  void shouldRetry_shouldStopAfterMaxRetries() {
    WhisperException failure = new WhisperException("boom", 500, null);

    assertThat(policy.shouldRetry(failure, 0)).isTrue();
    assertThat(policy.shouldRetry(failure, 2)).isTrue();
    assertThat(policy.shouldRetry(failure, 3)).isFalse();
  }

  @Test
  void backoff_shouldGrowExponentiallyForTransientFailures() {
    WhisperException failure = new WhisperException("boom", 503, null);

    assertThat(policy.backoff(failure, 0)).isEqualTo(Duration.ofMillis(1000));
    assertThat(policy.backoff(failure, 1)).isEqualTo(Duration.ofMillis(2000));
    assertThat(policy.backoff(failure, 2)).isEqualTo(Duration.ofMillis(4000));
  }

  @Test
  void backoff_shouldUseResetHintWhenRateLimited() {
    WhisperException failure = new WhisperException("slow down", 429, 1500L);

    assertThat(policy.backoff(failure, 2)).isEqualTo(Duration.ofMillis(1500));
  }

  @Test
  void backoff_shouldFallBackToFixedDelayWithoutHint() {
    WhisperException failure = new WhisperException("slow down", 429, null);

    assertThat(policy.backoff(failure, 0)).isEqualTo(Duration.ofMillis(2000));
  }
}
