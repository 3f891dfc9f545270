package com.scholary.audio.segmenter.job;

import com.scholary.audio.segmenter.api.JobStatusResponse.Status;
import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.api.TranscriptionResponse;
import java.time.Instant;

/**
 * Represents an async transcription job.
 *
 * <p>Tracks the coarse status, the fine-grained state and the result. Updated from the job's worker
 * thread and read from request threads, hence the volatile fields.
 */
public class TranscriptionJob {

  private final String jobId;
  private final TranscriptionRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile JobState state;
  private volatile TranscriptionResponse result;
  private volatile String error;

  public TranscriptionJob(String jobId, TranscriptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.state = JobState.PLANNED;
  }

  public String getJobId() {
    return jobId;
  }

  public TranscriptionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public JobState getState() {
    return state;
  }

  public void setState(JobState state) {
    this.state = state;
  }

  public TranscriptionResponse getResult() {
    return result;
  }

  public void setResult(TranscriptionResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
