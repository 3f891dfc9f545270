package com.scholary.audio.segmenter.transcription;

import java.time.Duration;

/**
 * Timed suspension used between retries.
 *
 * <p>Exists so tests can observe backoff delays without waiting for them.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
