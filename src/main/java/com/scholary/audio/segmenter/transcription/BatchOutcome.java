package com.scholary.audio.segmenter.transcription;

import com.scholary.audio.segmenter.chunking.ChunkSpec;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the scheduler learned about a job's chunks.
 *
 * <p>{@code results} has one slot per planned chunk, indexed by chunk index. Slots of chunks that
 * were dropped for being too small are null. {@code exhaustedChunks} lists the chunks that kept
 * failing transiently until their retries ran out.
 */
public record BatchOutcome(List<ChunkResult> results, List<ChunkSpec> exhaustedChunks) {

  public BatchOutcome {
    results = Collections.unmodifiableList(Arrays.asList(results.toArray(new ChunkResult[0])));
    exhaustedChunks = List.copyOf(exhaustedChunks);
  }

  /** Chunks actually sent for transcription, i.e. all but the dropped ones. */
  public int submittedChunks() {
    return (int) results.stream().filter(Objects::nonNull).count();
  }

  public int droppedChunks() {
    return results.size() - submittedChunks();
  }

  public int successfulChunks() {
    return successfulResults().size();
  }

  public int failedChunks() {
    return submittedChunks() - successfulChunks();
  }

  /** Successful results in chunk order. */
  public List<ChunkResult> successfulResults() {
    return results.stream().filter(Objects::nonNull).filter(ChunkResult::success).toList();
  }
}
