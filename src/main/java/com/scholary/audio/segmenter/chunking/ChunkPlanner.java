package com.scholary.audio.segmenter.chunking;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits an audio file into fixed-size byte ranges.
 *
 * <p>Ranges are contiguous and never overlap. Every range is exactly {@code chunkSize} bytes long
 * except the last one, which takes whatever is left:
 *
 * <pre>
 * N = 12 MB, C = 5 MB
 * Chunk 0: [0 MB, 5 MB)
 * Chunk 1: [5 MB, 10 MB)
 * Chunk 2: [10 MB, 12 MB)
 * </pre>
 *
 * <p>Splitting on bytes instead of time means chunk boundaries can fall inside an audio frame. The
 * transcription service tolerates that for reasonably sized slices; tiny trailing slices are
 * dropped later by {@link ChunkFetcher}.
 */
@Component
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

  /**
   * Plan byte ranges covering {@code [0, totalBytes)}.
   *
   * @param totalBytes size of the audio file in bytes
   * @param chunkSize maximum size of each range in bytes
   * @return ordered chunk specs, empty when the file is empty
   */
  public List<ChunkSpec> plan(long totalBytes, long chunkSize) {
    if (totalBytes < 0) {
      throw new IllegalArgumentException("Total bytes cannot be negative");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }

    List<ChunkSpec> chunks = new ArrayList<>();
    long offset = 0;
    while (offset < totalBytes) {
      long end = Math.min(offset + chunkSize, totalBytes);
      chunks.add(new ChunkSpec(chunks.size(), offset, end));
      offset = end;
    }

    LOGGER.info(
        "Planned {} chunks: totalBytes={}, chunkSize={} ({} MB)",
        chunks.size(),
        totalBytes,
        chunkSize,
        chunkSize / 1024 / 1024);
    return chunks;
  }
}
