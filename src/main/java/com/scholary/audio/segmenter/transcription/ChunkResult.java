package com.scholary.audio.segmenter.transcription;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.audio.segmenter.whisper.TranscriptSegment;
import com.scholary.audio.segmenter.whisper.WhisperResponse;
import java.util.List;

/**
 * Result of transcribing one chunk, successful or not.
 *
 * <p>Segments are chunk-relative. {@code duration} is the audio length reported by the service
 * and is 0 for failed chunks. {@code attempts} counts every call made, including the first.
 */
public record ChunkResult(
    int index,
    ChunkOutcome outcome,
    String text,
    List<TranscriptSegment> segments,
    double duration,
    int attempts,
    String errorDetail) {

  public ChunkResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static ChunkResult success(int index, WhisperResponse response, int attempts) {
    return new ChunkResult(
        index,
        ChunkOutcome.SUCCESS,
        response.text(),
        response.segments(),
        response.duration(),
        attempts,
        null);
  }

  public static ChunkResult permanentFailure(int index, int attempts, String errorDetail) {
    return new ChunkResult(
        index, ChunkOutcome.FAILED_PERMANENT, null, List.of(), 0.0, attempts, errorDetail);
  }

  public static ChunkResult retriesExhausted(int index, int attempts, String errorDetail) {
    return new ChunkResult(
        index,
        ChunkOutcome.FAILED_TRANSIENT_EXHAUSTED,
        null,
        List.of(),
        0.0,
        attempts,
        errorDetail);
  }

  @JsonProperty("success")
  public boolean success() {
    return outcome == ChunkOutcome.SUCCESS;
  }

  @JsonProperty("permanent")
  public boolean permanent() {
    return outcome == ChunkOutcome.FAILED_PERMANENT;
  }
}
