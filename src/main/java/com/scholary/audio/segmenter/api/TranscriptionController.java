package com.scholary.audio.segmenter.api;

import com.scholary.audio.segmenter.job.JobRepository;
import com.scholary.audio.segmenter.job.JobState;
import com.scholary.audio.segmenter.job.TranscriptionJob;
import com.scholary.audio.segmenter.service.TranscriptionJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for audio transcription.
 *
 * <p>Transcription is asynchronous: a request is accepted with a job ID, which the client polls
 * until the job has completed or failed. A request the job pool cannot take is recorded as a failed
 * job and answered with 503.
 */
@RestController
@RequestMapping("/api/transcriptions")
@Tag(name = "Transcription", description = "Chunked transcription and topic segmentation API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionJobRunner jobRunner;
  private final JobRepository jobRepository;

  public TranscriptionController(TranscriptionJobRunner jobRunner, JobRepository jobRepository) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping
  @Operation(
      summary = "Start transcription",
      description = "Start an asynchronous transcription job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @Valid @RequestBody TranscriptionRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Transcription request: audio={}/{}, fileKey={}",
        request.audioBucket(),
        request.audioKey(),
        request.fileKey());

    TranscriptionJob job = new TranscriptionJob(jobId, request);
    jobRepository.save(job);
    try {
      jobRunner.run(job);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job queue is full, rejecting job {}", jobId);
      job.setStatus(JobStatusResponse.Status.FAILED);
      job.setState(JobState.FAILED);
      job.setError("Job queue is full, try again later");
      jobRepository.save(job);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(new AsyncJobResponse(jobId));
    }

    LOGGER.info("Created async transcription job: {}", jobId);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  @GetMapping("/{jobId}")
  @Operation(
      summary = "Get job status",
      description = "Check the status of an async transcription job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
    return jobRepository
        .findById(jobId)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getState(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
