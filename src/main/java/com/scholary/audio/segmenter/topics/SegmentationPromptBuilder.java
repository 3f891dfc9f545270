package com.scholary.audio.segmenter.topics;

import com.scholary.audio.segmenter.transcript.Timecodes;
import com.scholary.audio.segmenter.transcript.Timeline;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Builds the topic segmentation prompt from the classpath template {@code
 * prompts/topic-segmentation.txt}.
 *
 * <p>Placeholders: {@code {context}}, {@code {transcript}}, {@code {minTopics}}, {@code
 * {maxTopics}} and {@code {duration}}.
 */
@Component
public class SegmentationPromptBuilder {

  static final String TEMPLATE_PATH = "prompts/topic-segmentation.txt";
  static final String DEFAULT_CONTEXT = "Audio recording";

  private final String template;
  private final String context;

  @Autowired
  public SegmentationPromptBuilder(SegmentationProperties properties) {
    this(loadTemplate(), properties.context());
  }

  SegmentationPromptBuilder(String template, String context) {
    this.template = template;
    this.context = context == null || context.isBlank() ? DEFAULT_CONTEXT : context;
  }

  public String build(Timeline timeline, TopicCountRange range) {
    return template
        .replace("{context}", context)
        .replace("{minTopics}", String.valueOf(range.minTopics()))
        .replace("{maxTopics}", String.valueOf(range.maxTopics()))
        .replace("{duration}", Timecodes.format(timeline.totalDurationSeconds()))
        // last, so braces inside the transcript are left alone
        .replace("{transcript}", timeline.toTimestampedTranscript());
  }

  static String loadTemplate() {
    try {
      return StreamUtils.copyToString(
          new ClassPathResource(TEMPLATE_PATH).getInputStream(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load prompt template " + TEMPLATE_PATH, e);
    }
  }
}
