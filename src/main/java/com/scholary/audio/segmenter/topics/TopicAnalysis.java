package com.scholary.audio.segmenter.topics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scholary.audio.segmenter.transcript.Timecodes;
import java.util.List;

/** Topic segments returned by the language model, in timeline order. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopicAnalysis(List<TopicSegment> segments) {

  /**
   * Mean segment length in whole seconds, rounded.
   *
   * @return the mean, or 0 when there are no segments
   */
  public long averageSegmentDurationSeconds() {
    if (segments == null || segments.isEmpty()) {
      return 0;
    }
    long total = 0;
    for (TopicSegment segment : segments) {
      total += Timecodes.parse(segment.endTime()) - Timecodes.parse(segment.startTime());
    }
    return Math.round((double) total / segments.size());
  }
}
