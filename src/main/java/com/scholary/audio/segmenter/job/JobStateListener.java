package com.scholary.audio.segmenter.job;

/** Receives state transitions of a transcription run. */
@FunctionalInterface
public interface JobStateListener {

  JobStateListener NO_OP = state -> {};

  void onStateChange(JobState state);
}
