package com.scholary.audio.segmenter.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audio.segmenter.config.TranscriptionProperties;
import java.io.EOFException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkFetcherTest {

  @TempDir Path tempDir;

  private Path audio;
  private byte[] content;
  private final ChunkFetcher fetcher = new ChunkFetcher(ChunkFetcher.DEFAULT_MIN_CHUNK_BYTES);

  @BeforeEach
  void setUp() throws Exception {
    content = new byte[20_000];
    for (int i = 0; i < content.length; i++) {
      content[i] = (byte) (i % 251);
    }
    audio = tempDir.resolve("audio.mp3");
    Files.write(audio, content);
  }

  @Test
  void fetch_shouldReadExactlyTheRequestedRange() throws Exception {
    Optional<byte[]> bytes = fetcher.fetch(audio, new ChunkSpec(1, 5_000, 15_000));

    assertThat(bytes).isPresent();
    assertThat(bytes.get()).isEqualTo(Arrays.copyOfRange(content, 5_000, 15_000));
  }

  @Test
  void fetch_shouldSkipChunksBelowMinimumSize() throws Exception {
    Optional<byte[]> bytes = fetcher.fetch(audio, new ChunkSpec(2, 16_000, 20_000 - 1));

    assertThat(bytes).isEmpty();
  }

  @Test
  void fetch_shouldAcceptChunkOfExactlyMinimumSize() throws Exception {
    Optional<byte[]> bytes = fetcher.fetch(audio, new ChunkSpec(2, 15_904, 20_000));

    assertThat(bytes).isPresent();
    assertThat(bytes.get()).hasSize(4096);
  }

  @Test
  void fetch_shouldUseMinimumSizeFromChunkingProperties() throws Exception {
    TranscriptionProperties properties =
        new TranscriptionProperties(
            new TranscriptionProperties.ChunkingProperties(4_000, 5, 1024),
            new TranscriptionProperties.RetryProperties(3, 2000, 1000),
            tempDir.toString(),
            true,
            2,
            10,
            4);
    ChunkFetcher configured = new ChunkFetcher(properties);

    assertThat(configured.fetch(audio, new ChunkSpec(3, 18_000, 20_000))).isPresent();
    assertThat(configured.fetch(audio, new ChunkSpec(4, 19_000, 20_000))).isEmpty();
  }

  @Test
  void fetch_shouldFailWhenFileEndsBeforeRange() {
    assertThatThrownBy(() -> fetcher.fetch(audio, new ChunkSpec(0, 15_000, 30_000)))
        .isInstanceOf(EOFException.class);
  }
}
