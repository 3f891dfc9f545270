package com.scholary.audio.segmenter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls chunk sizing, retry behaviour, the topic segmentation fallback, and the thread pools
 * jobs and chunks run on.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Valid @NotNull ChunkingProperties chunking,
    @Valid @NotNull RetryProperties retry,
    @NotBlank String tempDir,
    boolean segmentationFallback,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive int chunkExecutorThreads) {

  public record ChunkingProperties(
      @Positive long chunkSizeBytes,
      @Positive int maxConcurrentRequests,
      @Positive int minChunkBytes) {}

  public record RetryProperties(
      @PositiveOrZero int maxRetries,
      @Positive long rateLimitFallbackMs,
      @Positive long baseBackoffMs) {}
}
