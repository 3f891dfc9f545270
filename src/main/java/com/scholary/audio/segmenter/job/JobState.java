package com.scholary.audio.segmenter.job;

/**
 * Fine-grained lifecycle of a transcription run.
 *
 * <pre>
 * PLANNED -> CHUNKING -> GATE_CHECK -> FAILED_INSUFFICIENT
 *                                   -> RECONCILED -> SEGMENTING -> SEGMENTED          -> DONE
 *                                                               -> DEGRADED_NO_TOPICS -> DONE
 * </pre>
 *
 * <p>{@link #FAILED} covers job-fatal errors outside the success gate, such as a failed download
 * or a segmentation failure with the fallback disabled.
 */
public enum JobState {
  PLANNED,
  CHUNKING,
  GATE_CHECK,
  FAILED_INSUFFICIENT,
  RECONCILED,
  SEGMENTING,
  SEGMENTED,
  DEGRADED_NO_TOPICS,
  DONE,
  FAILED
}
