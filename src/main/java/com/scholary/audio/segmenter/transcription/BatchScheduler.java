package com.scholary.audio.segmenter.transcription;

import com.scholary.audio.segmenter.chunking.ChunkSpec;
import com.scholary.audio.segmenter.logging.StructuredLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs chunk transcription in sequential batches of bounded size.
 *
 * <p>Within a batch every chunk runs concurrently on the chunk executor and the batch waits for
 * all of them to reach a terminal result. Nothing is cancelled when a sibling fails. The next
 * batch starts only once the previous one has fully resolved, so at most {@code concurrency}
 * chunk buffers are in memory at a time.
 *
 * <p>Results are stored by chunk index, so completion order has no effect on the merge.
 */
@Component
public class BatchScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChunkTranscriber chunkTranscriber;
  private final Executor executor;

  public BatchScheduler(
      ChunkTranscriber chunkTranscriber, @Qualifier("chunkExecutor") Executor executor) {
    this.chunkTranscriber = chunkTranscriber;
    this.executor = executor;
  }

  /**
   * Transcribe all chunks.
   *
   * @param audioPath the local audio file
   * @param chunks the planned chunks, indexed 0..n-1
   * @param concurrency maximum number of chunks in flight at once
   * @return per-chunk results and the chunks that exhausted their retries
   */
  public BatchOutcome schedule(Path audioPath, List<ChunkSpec> chunks, int concurrency) {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("Concurrency must be positive");
    }

    ChunkResult[] results = new ChunkResult[chunks.size()];
    List<ChunkSpec> exhausted = new ArrayList<>();
    int totalBatches = (chunks.size() + concurrency - 1) / concurrency;

    for (int from = 0; from < chunks.size(); from += concurrency) {
      List<ChunkSpec> batch = chunks.subList(from, Math.min(from + concurrency, chunks.size()));
      structuredLogger.logBatchStarted(from / concurrency + 1, totalBatches, batch.size());

      List<CompletableFuture<Optional<ChunkResult>>> futures = new ArrayList<>();
      for (ChunkSpec chunk : batch) {
        futures.add(
            CompletableFuture.supplyAsync(() -> chunkTranscriber.process(audioPath, chunk), executor)
                .exceptionally(
                    ex -> {
                      LOGGER.error("Chunk {} task failed unexpectedly", chunk.index(), ex);
                      return Optional.of(
                          ChunkResult.permanentFailure(
                              chunk.index(), 0, "Chunk task failed: " + ex.getMessage()));
                    }));
      }

      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

      for (int i = 0; i < batch.size(); i++) {
        ChunkSpec chunk = batch.get(i);
        Optional<ChunkResult> result = futures.get(i).join();
        if (result.isEmpty()) {
          continue;
        }
        results[chunk.index()] = result.get();
        if (result.get().outcome() == ChunkOutcome.FAILED_TRANSIENT_EXHAUSTED) {
          exhausted.add(chunk);
        }
      }
    }

    BatchOutcome outcome = new BatchOutcome(Arrays.asList(results), exhausted);
    LOGGER.info(
        "Processing complete: planned={}, submitted={}, succeeded={}, dropped={}, exhausted={}",
        chunks.size(),
        outcome.submittedChunks(),
        outcome.successfulChunks(),
        outcome.droppedChunks(),
        exhausted.size());
    return outcome;
  }
}
