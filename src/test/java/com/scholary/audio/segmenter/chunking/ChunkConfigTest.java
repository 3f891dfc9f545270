package com.scholary.audio.segmenter.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChunkConfigTest {

  private static final long CHUNK = 5 * 1024 * 1024;

  @Test
  void forAudioSize_shouldCapConcurrencyAtEstimatedChunks() {
    ChunkConfig config = ChunkConfig.forAudioSize(12 * 1024 * 1024, CHUNK, 5);

    assertThat(config.estimatedChunks()).isEqualTo(3);
    assertThat(config.concurrentRequests()).isEqualTo(3);
    assertThat(config.chunkSizeBytes()).isEqualTo(CHUNK);
  }

  @Test
  void forAudioSize_shouldCapConcurrencyAtConfiguredMaximum() {
    ChunkConfig config = ChunkConfig.forAudioSize(100 * CHUNK, CHUNK, 5);

    assertThat(config.estimatedChunks()).isEqualTo(100);
    assertThat(config.concurrentRequests()).isEqualTo(5);
  }

  @Test
  void forAudioSize_shouldKeepAtLeastOneRequestForEmptyFile() {
    ChunkConfig config = ChunkConfig.forAudioSize(0, CHUNK, 5);

    assertThat(config.estimatedChunks()).isZero();
    assertThat(config.concurrentRequests()).isEqualTo(1);
  }
}
