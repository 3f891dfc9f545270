package com.scholary.audio.segmenter.api;

import com.scholary.audio.segmenter.job.JobState;

/**
 * Response for job status query.
 *
 * <p>{@code status} is the coarse lifecycle, {@code state} the step the job is in or ended in. The
 * result is present once the job has completed.
 */
public record JobStatusResponse(
    String jobId, Status status, JobState state, TranscriptionResponse result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
