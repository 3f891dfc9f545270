package com.scholary.audio.segmenter.service;

import com.scholary.audio.segmenter.topics.TopicAnalysis;
import com.scholary.audio.segmenter.transcript.Timeline;
import com.scholary.audio.segmenter.transcription.ChunkResult;
import java.util.List;

/**
 * Output of one engine run.
 *
 * @param transcription text of the successful chunks, in chunk order, joined by single spaces
 * @param transcriptionResults the successful chunk results, in chunk order
 * @param topicAnalysis topic segments, or null when segmentation failed and the fallback applied
 * @param analysisError why segmentation failed, or null
 * @param timeline the reconciled timeline the topics were derived from
 * @param stats chunk counts for diagnostics
 */
public record TranscriptionResult(
    String transcription,
    List<ChunkResult> transcriptionResults,
    TopicAnalysis topicAnalysis,
    String analysisError,
    Timeline timeline,
    ChunkStats stats) {

  public TranscriptionResult {
    transcriptionResults = List.copyOf(transcriptionResults);
  }

  public boolean segmentationCompleted() {
    return topicAnalysis != null;
  }

  public int totalSegments() {
    return transcriptionResults.stream().mapToInt(result -> result.segments().size()).sum();
  }

  /** How the planned chunks ended up. Dropped chunks were too small to submit. */
  public record ChunkStats(
      int plannedChunks,
      int submittedChunks,
      int successfulChunks,
      int droppedChunks,
      List<Integer> exhaustedChunkIndices) {

    public ChunkStats {
      exhaustedChunkIndices = List.copyOf(exhaustedChunkIndices);
    }
  }
}
