package com.scholary.audio.segmenter.service;

import com.scholary.audio.segmenter.api.JobStatusResponse.Status;
import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.api.TranscriptionResponse;
import com.scholary.audio.segmenter.job.JobRepository;
import com.scholary.audio.segmenter.job.JobState;
import com.scholary.audio.segmenter.job.TranscriptionJob;
import com.scholary.audio.segmenter.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs transcription jobs in the background.
 *
 * <p>{@link #run} executes on the {@code taskExecutor} pool. Every job ends as {@code COMPLETED} or
 * {@code FAILED}; failures keep the message on the job.
 */
@Service
public class TranscriptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobRunner.class);

  private final TranscriptionPipeline pipeline;
  private final JobRepository jobRepository;

  public TranscriptionJobRunner(TranscriptionPipeline pipeline, JobRepository jobRepository) {
    this.pipeline = pipeline;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void run(TranscriptionJob job) {
    TranscriptionRequest request = job.getRequest();
    StructuredLogger.setJobContext(job.getJobId(), request.audioBucket(), request.audioKey());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      TranscriptionResponse result = pipeline.process(request, jobRepository.trackState(job));

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);
      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      if (job.getState() != JobState.FAILED_INSUFFICIENT) {
        job.setState(JobState.FAILED);
      }
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);

    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
