package com.scholary.audio.segmenter.transcription;

/** Terminal state of a single chunk. */
public enum ChunkOutcome {
  SUCCESS,
  FAILED_PERMANENT,
  FAILED_TRANSIENT_EXHAUSTED
}
