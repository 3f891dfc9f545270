package com.scholary.audio.segmenter.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Verbose response from the speech-to-text API for one chunk.
 *
 * <p>{@code duration} is the audio length the service decoded from the chunk, in seconds. It is
 * what the timeline uses to offset the next chunk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    String text, List<TranscriptSegment> segments, double duration, String language) {

  public WhisperResponse {
    if (segments == null) {
      segments = List.of();
    }
    if (text == null) {
      text = "";
    }
  }
}
