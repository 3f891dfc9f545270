package com.scholary.audio.segmenter.topics;

import com.scholary.audio.segmenter.transcript.Timecodes;
import com.scholary.audio.segmenter.transcript.Timeline;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Segments a reconciled timeline into topics.
 *
 * <p>The count range and the coverage rules are requests to the model, not guarantees. Responses
 * that miss them are logged and returned as they are.
 */
@Component
public class TopicSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopicSegmenter.class);

  private final TopicPlanner planner;
  private final SegmentationPromptBuilder promptBuilder;
  private final SegmentationClient client;

  public TopicSegmenter(
      TopicPlanner planner, SegmentationPromptBuilder promptBuilder, SegmentationClient client) {
    this.planner = planner;
    this.promptBuilder = promptBuilder;
    this.client = client;
  }

  /**
   * @throws SegmentationException if the model call fails or returns no usable segments
   */
  public TopicAnalysis segment(Timeline timeline) {
    TopicCountRange range = planner.plan(timeline.totalDurationSeconds());
    String prompt = promptBuilder.build(timeline, range);
    TopicAnalysis analysis = client.requestSegments(prompt);
    checkExpectations(analysis, range, timeline.totalDurationSeconds());
    return analysis;
  }

  private void checkExpectations(TopicAnalysis analysis, TopicCountRange range, double total) {
    List<TopicSegment> segments = analysis.segments();
    if (segments.size() < range.minTopics() || segments.size() > range.maxTopics()) {
      LOGGER.warn(
          "Model returned {} segments, requested {}-{}",
          segments.size(),
          range.minTopics(),
          range.maxTopics());
    }
    if (segments.isEmpty()) {
      return;
    }

    if (Timecodes.parse(segments.get(0).startTime()) != 0) {
      LOGGER.warn("First segment starts at {}, expected 00:00", segments.get(0).startTime());
    }
    String expectedEnd = Timecodes.format(total);
    String lastEnd = segments.get(segments.size() - 1).endTime();
    if (Timecodes.parse(lastEnd) != Timecodes.parse(expectedEnd)) {
      LOGGER.warn("Last segment ends at {}, expected {}", lastEnd, expectedEnd);
    }
    for (int i = 1; i < segments.size(); i++) {
      String previousEnd = segments.get(i - 1).endTime();
      String start = segments.get(i).startTime();
      if (Timecodes.parse(previousEnd) != Timecodes.parse(start)) {
        LOGGER.warn("Segment {} starts at {} but previous ends at {}", i, start, previousEnd);
      }
    }
  }
}
