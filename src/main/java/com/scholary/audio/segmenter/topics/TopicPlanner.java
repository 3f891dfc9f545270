package com.scholary.audio.segmenter.topics;

import com.scholary.audio.segmenter.transcript.Timecodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a recording's duration to the number of topics to request.
 *
 * <pre>
 * duration          category     topics
 * &lt; 1 min           very_short   2-3
 * 1 min - 20 min    short        3-6
 * 20 min - 40 min   medium       5-8
 * 40 min +          long         8-10
 * </pre>
 *
 * <p>The duration is truncated to whole seconds before it is classified.
 */
@Component
public class TopicPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopicPlanner.class);

  private static final int SHORT_FROM_SECONDS = 60;
  private static final int MEDIUM_FROM_SECONDS = 1200;
  private static final int LONG_FROM_SECONDS = 2400;

  public TopicCountRange plan(double durationSeconds) {
    long duration = (long) Math.floor(durationSeconds);

    TopicCountRange range;
    if (duration >= LONG_FROM_SECONDS) {
      range = new TopicCountRange(8, 10, TopicCategory.LONG);
    } else if (duration >= MEDIUM_FROM_SECONDS) {
      range = new TopicCountRange(5, 8, TopicCategory.MEDIUM);
    } else if (duration >= SHORT_FROM_SECONDS) {
      range = new TopicCountRange(3, 6, TopicCategory.SHORT);
    } else {
      range = new TopicCountRange(2, 3, TopicCategory.VERY_SHORT);
    }

    LOGGER.info(
        "Duration {} ({}s): category={}, topics={}-{}",
        Timecodes.format(duration),
        duration,
        range.category().label(),
        range.minTopics(),
        range.maxTopics());
    return range;
  }
}
