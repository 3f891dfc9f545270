package com.scholary.audio.segmenter.topics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A labelled span of the recording, with {@code MM:SS} start and end times. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopicSegment(String startTime, String endTime, String topic, String description) {}
