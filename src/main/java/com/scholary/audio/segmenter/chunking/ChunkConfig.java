package com.scholary.audio.segmenter.chunking;

/**
 * Chunk size and batch concurrency for one audio file.
 *
 * <p>Concurrency never exceeds the number of chunks the file will be split into, so a small file
 * does not reserve executor slots it cannot use.
 */
public record ChunkConfig(long chunkSizeBytes, int concurrentRequests, int estimatedChunks) {

  public ChunkConfig {
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    if (concurrentRequests <= 0) {
      throw new IllegalArgumentException("Concurrent requests must be positive");
    }
  }

  /**
   * Derive the configuration for a file of the given size.
   *
   * @param totalBytes size of the audio file
   * @param chunkSizeBytes target size of each chunk
   * @param maxConcurrentRequests upper bound on chunks transcribed at the same time
   * @return the derived configuration
   */
  public static ChunkConfig forAudioSize(
      long totalBytes, long chunkSizeBytes, int maxConcurrentRequests) {
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    int estimatedChunks = (int) ((Math.max(0, totalBytes) + chunkSizeBytes - 1) / chunkSizeBytes);
    int concurrency = Math.max(1, Math.min(maxConcurrentRequests, estimatedChunks));
    return new ChunkConfig(chunkSizeBytes, concurrency, estimatedChunks);
  }
}
