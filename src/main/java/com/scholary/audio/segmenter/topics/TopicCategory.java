package com.scholary.audio.segmenter.topics;

import com.fasterxml.jackson.annotation.JsonValue;

/** Length class of a recording, used to pick how many topics to ask for. */
public enum TopicCategory {
  VERY_SHORT("very_short"),
  SHORT("short"),
  MEDIUM("medium"),
  LONG("long");

  private final String label;

  TopicCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
