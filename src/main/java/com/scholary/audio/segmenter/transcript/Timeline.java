package com.scholary.audio.segmenter.transcript;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The reconstructed timeline of a recording.
 *
 * <p>{@code totalDurationSeconds} is the sum of the reported durations of all successful chunks.
 * Chunks that failed or were dropped are missing from both the segments and the total.
 */
public record Timeline(List<GlobalSegment> segments, double totalDurationSeconds) {

  public Timeline {
    segments = List.copyOf(segments);
  }

  /**
   * Render the timeline as one line per segment.
   *
   * <pre>
   * [00:00 - 00:05] Buenos días a todos
   * [00:05 - 00:12] Hoy hablamos de...
   * </pre>
   */
  public String toTimestampedTranscript() {
    return segments.stream()
        .map(
            segment ->
                String.format(
                    "[%s - %s] %s",
                    Timecodes.format(segment.start()),
                    Timecodes.format(segment.end()),
                    segment.text()))
        .collect(Collectors.joining("\n"));
  }
}
