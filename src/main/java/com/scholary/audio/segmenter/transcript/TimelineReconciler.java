package com.scholary.audio.segmenter.transcript;

import com.scholary.audio.segmenter.transcription.ChunkResult;
import com.scholary.audio.segmenter.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges independently transcribed chunks into one timeline.
 *
 * <p>Chunks were cut on byte boundaries, so their start time in the recording is unknown. Instead a
 * running offset is kept: each successful chunk's segments are shifted by the offset, then the
 * chunk's reported duration is added to it.
 *
 * <pre>
 * chunk 0: duration 30s, segment [0, 5]  -> [0, 5]
 * chunk 1: duration 28s, segment [2, 8]  -> [32, 38]
 * </pre>
 *
 * <p>The reported duration is used rather than the last segment's end, which misses trailing
 * silence. Failed and dropped chunks add nothing, which leaves an unrecoverable gap at their
 * position: everything after them is shifted earlier by their length.
 */
@Component
public class TimelineReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineReconciler.class);

  /**
   * Build the global timeline.
   *
   * @param results chunk results; nulls and failures are skipped
   * @return segments in chunk order then in-chunk order, with the accumulated duration
   */
  public Timeline reconcile(List<ChunkResult> results) {
    List<ChunkResult> ordered =
        results.stream()
            .filter(Objects::nonNull)
            .filter(ChunkResult::success)
            .sorted(Comparator.comparingInt(ChunkResult::index))
            .toList();

    List<GlobalSegment> segments = new ArrayList<>();
    double offset = 0.0;

    for (ChunkResult result : ordered) {
      LOGGER.debug(
          "Chunk {}: offset={}s, segments={}, duration={}s",
          result.index(),
          offset,
          result.segments().size(),
          result.duration());

      for (TranscriptSegment segment : result.segments()) {
        segments.add(
            new GlobalSegment(
                segment.text(), offset + segment.start(), offset + segment.end(), result.index()));
      }
      offset += result.duration();
    }

    LOGGER.info(
        "Reconciled {} segments from {} chunks, total duration {} ({}s)",
        segments.size(),
        ordered.size(),
        Timecodes.format(offset),
        offset);
    return new Timeline(segments, offset);
  }
}
