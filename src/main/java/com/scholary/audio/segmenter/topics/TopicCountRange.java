package com.scholary.audio.segmenter.topics;

/** Number of topic segments to request for a recording. */
public record TopicCountRange(int minTopics, int maxTopics, TopicCategory category) {

  public TopicCountRange {
    if (minTopics <= 0 || maxTopics < minTopics) {
      throw new IllegalArgumentException(
          String.format("Invalid topic range: %d-%d", minTopics, maxTopics));
    }
  }
}
