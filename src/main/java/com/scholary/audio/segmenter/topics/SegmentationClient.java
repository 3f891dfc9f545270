package com.scholary.audio.segmenter.topics;

/** Interface for the text-generation capability used to segment transcripts into topics. */
public interface SegmentationClient {

  /**
   * Ask the model for topic segments.
   *
   * @param prompt the full prompt, transcript included
   * @return the parsed segment list, never null
   * @throws SegmentationException on any failure, including an unusable response
   */
  TopicAnalysis requestSegments(String prompt);
}
