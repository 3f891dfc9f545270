package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.transcription.RetryPolicy;
import com.scholary.audio.segmenter.transcription.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the TranscriptionProperties and builds the retry policy from them.
 */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public RetryPolicy retryPolicy(TranscriptionProperties properties) {
    TranscriptionProperties.RetryProperties retry = properties.retry();
    return new RetryPolicy(retry.maxRetries(), retry.rateLimitFallbackMs(), retry.baseBackoffMs());
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.THREAD;
  }
}
