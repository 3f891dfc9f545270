package com.scholary.audio.segmenter.api;

import com.scholary.audio.segmenter.topics.TopicSegment;
import java.util.List;

/**
 * Response for a completed transcription.
 *
 * <p>{@code topicSegments} and {@code topicsKey} are null when segmentation fell back, in which
 * case {@code segmentationError} says why.
 */
public record TranscriptionResponse(
    String transcription,
    List<TopicSegment> topicSegments,
    boolean segmentationCompleted,
    String segmentationError,
    String transcriptionKey,
    String topicsKey,
    Diagnostics diagnostics) {

  public record Diagnostics(
      int plannedChunks,
      int submittedChunks,
      int successfulChunks,
      int droppedChunks,
      List<Integer> exhaustedChunks,
      double totalDurationSeconds) {}
}
