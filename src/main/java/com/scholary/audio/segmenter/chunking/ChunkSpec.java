package com.scholary.audio.segmenter.chunking;

/**
 * A contiguous byte range of the source audio, transcribed as one unit.
 *
 * <p>{@code startByte} is inclusive, {@code endByte} is exclusive. The index is the chunk's
 * position in the plan and stays stable through scheduling and merging.
 */
public record ChunkSpec(int index, long startByte, long endByte) {

  public ChunkSpec {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative");
    }
    if (startByte < 0) {
      throw new IllegalArgumentException("Start byte cannot be negative");
    }
    if (endByte <= startByte) {
      throw new IllegalArgumentException("End byte must be > start byte");
    }
  }

  public long length() {
    return endByte - startByte;
  }
}
