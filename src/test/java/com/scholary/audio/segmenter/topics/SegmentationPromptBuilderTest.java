package com.scholary.audio.segmenter.topics;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audio.segmenter.transcript.GlobalSegment;
import com.scholary.audio.segmenter.transcript.Timeline;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentationPromptBuilderTest {

  private final Timeline timeline =
      new Timeline(
          List.of(
              new GlobalSegment("Bienvenidos al curso", 0, 4.5, 0),
              new GlobalSegment("Hoy veremos {llaves}", 4.5, 12, 0)),
          905.3);

  @Test
  void build_shouldIncludeTranscriptRangeAndDuration() {
    SegmentationPromptBuilder builder =
        new SegmentationPromptBuilder(SegmentationPromptBuilder.loadTemplate(), "Clase de historia");

    String prompt = builder.build(timeline, new TopicCountRange(3, 6, TopicCategory.SHORT));

    assertThat(prompt).contains("Context: Clase de historia");
    assertThat(prompt).contains("[00:00 - 00:04] Bienvenidos al curso");
    assertThat(prompt).contains("[00:04 - 00:12] Hoy veremos {llaves}");
    assertThat(prompt).contains("between 3 and 6 main topic segments");
    assertThat(prompt).contains("The last segment must end at 15:05");
    assertThat(prompt).contains("The first segment must start at 00:00");
    assertThat(prompt).doesNotContain("{minTopics}", "{duration}", "{transcript}", "{context}");
  }

  @Test
  void build_shouldUseDefaultContextWhenNoneConfigured() {
    SegmentationPromptBuilder builder = new SegmentationPromptBuilder("Context: {context}", " ");

    String prompt = builder.build(timeline, new TopicCountRange(2, 3, TopicCategory.VERY_SHORT));

    assertThat(prompt).isEqualTo("Context: " + SegmentationPromptBuilder.DEFAULT_CONTEXT);
  }
}
