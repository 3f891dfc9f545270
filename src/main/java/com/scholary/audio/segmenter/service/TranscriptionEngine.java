package com.scholary.audio.segmenter.service;

import com.scholary.audio.segmenter.chunking.ChunkConfig;
import com.scholary.audio.segmenter.chunking.ChunkPlanner;
import com.scholary.audio.segmenter.chunking.ChunkSpec;
import com.scholary.audio.segmenter.job.JobState;
import com.scholary.audio.segmenter.job.JobStateListener;
import com.scholary.audio.segmenter.logging.StructuredLogger;
import com.scholary.audio.segmenter.topics.TopicAnalysis;
import com.scholary.audio.segmenter.topics.TopicSegmenter;
import com.scholary.audio.segmenter.transcript.Timeline;
import com.scholary.audio.segmenter.transcript.TimelineReconciler;
import com.scholary.audio.segmenter.transcription.BatchOutcome;
import com.scholary.audio.segmenter.transcription.BatchScheduler;
import com.scholary.audio.segmenter.transcription.ChunkResult;
import com.scholary.audio.segmenter.transcription.InsufficientSuccessRateException;
import com.scholary.audio.segmenter.transcription.SuccessGate;
import com.scholary.audio.segmenter.whisper.TranscriptionClient;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one local audio file through chunked transcription and topic segmentation.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Plan fixed-size byte chunks
 *   <li>Resolve the transcription credentials; a failure here fails the run
 *   <li>Transcribe them in bounded batches, retrying per chunk
 *   <li>Check the success rate; too many failures fail the run
 *   <li>Rebuild a single timeline from the successful chunks
 *   <li>Ask the language model for topic segments
 * </ol>
 *
 * <p>A segmentation failure does not fail the run while the fallback is enabled: the result then
 * has no topics and carries the error message instead. With the fallback disabled it is rethrown.
 *
 * <p>The engine holds no per-run state, so concurrent runs on the same instance are independent.
 */
@Service
public class TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionEngine.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChunkPlanner chunkPlanner;
  private final TranscriptionClient transcriptionClient;
  private final BatchScheduler batchScheduler;
  private final SuccessGate successGate;
  private final TimelineReconciler timelineReconciler;
  private final TopicSegmenter topicSegmenter;
  private final boolean segmentationFallback;

  public TranscriptionEngine(
      ChunkPlanner chunkPlanner,
      TranscriptionClient transcriptionClient,
      BatchScheduler batchScheduler,
      SuccessGate successGate,
      TimelineReconciler timelineReconciler,
      TopicSegmenter topicSegmenter,
      @Value("${transcription.segmentationFallback:true}") boolean segmentationFallback) {
    this.chunkPlanner = chunkPlanner;
    this.transcriptionClient = transcriptionClient;
    this.batchScheduler = batchScheduler;
    this.successGate = successGate;
    this.timelineReconciler = timelineReconciler;
    this.topicSegmenter = topicSegmenter;
    this.segmentationFallback = segmentationFallback;
  }

  /**
   * Transcribe and segment a local audio file.
   *
   * @param audioPath the audio file
   * @param config chunk size and batch concurrency
   * @param listener notified of every state transition
   * @return the transcription, with topics unless segmentation fell back
   * @throws IOException if the file size cannot be read
   * @throws InsufficientSuccessRateException if too many chunks failed
   * @throws com.scholary.audio.segmenter.secrets.SecretException if the API key cannot be resolved
   */
  public TranscriptionResult transcribe(
      Path audioPath, ChunkConfig config, JobStateListener listener) throws IOException {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    try {
      transition(listener, JobState.PLANNED);
      long totalBytes = Files.size(audioPath);
      List<ChunkSpec> chunks = chunkPlanner.plan(totalBytes, config.chunkSizeBytes());
      LOGGER.info(
          "Starting transcription: file={}, size={} MB, chunks={}, concurrency={}",
          audioPath.getFileName(),
          totalBytes / 1024 / 1024,
          chunks.size(),
          config.concurrentRequests());

      try {
        transcriptionClient.resolveCredentials();
      } catch (RuntimeException e) {
        LOGGER.error("Could not resolve transcription credentials: {}", e.getMessage());
        transition(listener, JobState.FAILED);
        throw e;
      }

      transition(listener, JobState.CHUNKING);
      BatchOutcome outcome = batchScheduler.schedule(audioPath, chunks, config.concurrentRequests());

      transition(listener, JobState.GATE_CHECK);
      try {
        successGate.verify(outcome);
      } catch (InsufficientSuccessRateException e) {
        transition(listener, JobState.FAILED_INSUFFICIENT);
        throw e;
      }

      List<ChunkResult> successful = outcome.successfulResults();
      Timeline timeline = timelineReconciler.reconcile(successful);
      String transcription =
          successful.stream().map(ChunkResult::text).collect(Collectors.joining(" "));
      transition(listener, JobState.RECONCILED);

      transition(listener, JobState.SEGMENTING);
      TopicAnalysis topicAnalysis = null;
      String analysisError = null;
      try {
        topicAnalysis = topicSegmenter.segment(timeline);
        transition(listener, JobState.SEGMENTED);
      } catch (RuntimeException e) {
        if (!segmentationFallback) {
          LOGGER.error("Topic segmentation failed and fallback is disabled", e);
          transition(listener, JobState.FAILED);
          throw e;
        }
        analysisError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        LOGGER.warn("Topic segmentation failed, continuing without topics: {}", analysisError);
        transition(listener, JobState.DEGRADED_NO_TOPICS);
      }

      TranscriptionResult result =
          new TranscriptionResult(
              transcription,
              successful,
              topicAnalysis,
              analysisError,
              timeline,
              new TranscriptionResult.ChunkStats(
                  chunks.size(),
                  outcome.submittedChunks(),
                  outcome.successfulChunks(),
                  outcome.droppedChunks(),
                  outcome.exhaustedChunks().stream().map(ChunkSpec::index).toList()));
      transition(listener, JobState.DONE);

      LOGGER.info(
          "Transcription finished: chunks={}/{}, textLength={}, topics={}, duration={}s",
          outcome.successfulChunks(),
          outcome.submittedChunks(),
          transcription.length(),
          topicAnalysis != null ? topicAnalysis.segments().size() : 0,
          timeline.totalDurationSeconds());
      return result;

    } finally {
      MDC.remove("correlationId");
    }
  }

  private void transition(JobStateListener listener, JobState state) {
    structuredLogger.logJobState(state.name());
    listener.onStateChange(state);
  }
}
