package com.scholary.audio.segmenter.transcription;

import com.scholary.audio.segmenter.chunking.ChunkFetcher;
import com.scholary.audio.segmenter.chunking.ChunkSpec;
import com.scholary.audio.segmenter.logging.StructuredLogger;
import com.scholary.audio.segmenter.whisper.TranscriptionClient;
import com.scholary.audio.segmenter.whisper.WhisperException;
import com.scholary.audio.segmenter.whisper.WhisperResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Processes one chunk end to end: read its bytes, transcribe, retry in place.
 *
 * <p>Never throws. Every failure ends up as a failed {@link ChunkResult}, so a bad chunk cannot
 * take its batch siblings down with it. Failures other than a {@link WhisperException} (an
 * unreadable chunk, a missing API key) are not retried.
 *
 * <p>Retries run sequentially in the calling thread and reuse the bytes read for the first
 * attempt.
 */
@Component
public class ChunkTranscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriber.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChunkFetcher chunkFetcher;
  private final TranscriptionClient transcriptionClient;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public ChunkTranscriber(
      ChunkFetcher chunkFetcher,
      TranscriptionClient transcriptionClient,
      RetryPolicy retryPolicy,
      Sleeper sleeper) {
    this.chunkFetcher = chunkFetcher;
    this.transcriptionClient = transcriptionClient;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  /**
   * Read and transcribe a chunk.
   *
   * @param audioPath the local audio file
   * @param chunk the chunk to process
   * @return the result, or empty if the chunk was too small to submit
   */
  public Optional<ChunkResult> process(Path audioPath, ChunkSpec chunk) {
    byte[] audio;
    try {
      Optional<byte[]> bytes = chunkFetcher.fetch(audioPath, chunk);
      if (bytes.isEmpty()) {
        structuredLogger.logChunkDropped(chunk.index(), chunk.length());
        return Optional.empty();
      }
      audio = bytes.get();
    } catch (IOException e) {
      String detail = "Failed to read chunk bytes: " + e.getMessage();
      structuredLogger.logTranscribeFailed(
          chunk.index(), 0, true, WhisperException.NO_STATUS, detail);
      return Optional.of(ChunkResult.permanentFailure(chunk.index(), 0, detail));
    }

    structuredLogger.logChunkStarted(chunk.index(), chunk.startByte(), chunk.endByte());
    return Optional.of(transcribeWithRetry(audio, chunk.index()));
  }

  /**
   * Transcribe chunk bytes, retrying transient failures.
   *
   * @param audio the chunk bytes
   * @param chunkIndex the chunk index
   * @return the terminal result for the chunk
   */
  public ChunkResult transcribeWithRetry(byte[] audio, int chunkIndex) {
    long startTime = System.currentTimeMillis();
    int retries = 0;

    while (true) {
      int attempts = retries + 1;
      LOGGER.debug("Processing chunk {}, attempt {}", chunkIndex, attempts);

      try {
        WhisperResponse response = transcriptionClient.transcribe(audio, chunkIndex);
        structuredLogger.logChunkFinished(
            chunkIndex,
            response.segments().size(),
            response.duration(),
            attempts,
            System.currentTimeMillis() - startTime);
        return ChunkResult.success(chunkIndex, response, attempts);

      } catch (WhisperException e) {
        FailureClass failureClass = retryPolicy.classify(e);

        if (failureClass == FailureClass.PERMANENT) {
          structuredLogger.logTranscribeFailed(
              chunkIndex, attempts, true, e.getStatusCode(), e.getMessage());
          return ChunkResult.permanentFailure(chunkIndex, attempts, e.getMessage());
        }

        if (!retryPolicy.shouldRetry(e, retries)) {
          structuredLogger.logTranscribeFailed(
              chunkIndex, attempts, false, e.getStatusCode(), e.getMessage());
          return ChunkResult.retriesExhausted(chunkIndex, attempts, e.getMessage());
        }

        Duration backoff = retryPolicy.backoff(e, retries);
        structuredLogger.logTranscribeRetry(
            chunkIndex,
            retries + 1,
            retryPolicy.maxRetries(),
            failureClass.name(),
            e.getStatusCode(),
            backoff.toMillis(),
            e.getMessage());

        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          String detail = "Interrupted while backing off: " + e.getMessage();
          structuredLogger.logTranscribeFailed(
              chunkIndex, attempts, false, e.getStatusCode(), detail);
          return ChunkResult.retriesExhausted(chunkIndex, attempts, detail);
        }
        retries++;

      } catch (RuntimeException e) {
        String detail = "Unexpected transcription failure: " + e;
        LOGGER.error("Chunk {} failed unexpectedly", chunkIndex, e);
        structuredLogger.logTranscribeFailed(
            chunkIndex, attempts, true, WhisperException.NO_STATUS, detail);
        return ChunkResult.permanentFailure(chunkIndex, attempts, detail);
      }
    }
  }
}
