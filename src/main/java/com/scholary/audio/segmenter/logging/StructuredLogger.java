package com.scholary.audio.segmenter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its own fields in MDC for the duration of one log
 * call, so they end up as queryable fields next to the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, long startByte, long endByte) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("startByte", String.valueOf(startByte));
      MDC.put("endByte", String.valueOf(endByte));

      logger.debug(
          "Chunk started: index={}, bytes=[{}-{}), size={}KB",
          chunkIndex,
          startByte,
          endByte,
          (endByte - startByte) / 1024);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(
      int chunkIndex, int segments, double durationSeconds, int attempts, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("segments", String.valueOf(segments));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Chunk finished: index={}, segments={}, duration={}s, attempts={}, transcribe={}ms",
          chunkIndex,
          segments,
          durationSeconds,
          attempts,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk dropped for being too small to transcribe. */
  public void logChunkDropped(int chunkIndex, long sizeBytes) {
    try {
      MDC.put("event_type", "chunk_dropped");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));

      logger.info("Chunk dropped: index={}, size={} bytes", chunkIndex, sizeBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int chunkIndex,
      int attempt,
      int maxRetries,
      String failureClass,
      int statusCode,
      long backoffMs,
      String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("failureClass", failureClass);
      MDC.put("statusCode", String.valueOf(statusCode));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Transcribe retry: chunk={}, retry={}/{}, class={}, status={}, backoff={}ms, message={}",
          chunkIndex,
          attempt,
          maxRetries,
          failureClass,
          statusCode,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(
      int chunkIndex, int attempts, boolean permanent, int statusCode, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("permanent", String.valueOf(permanent));
      MDC.put("statusCode", String.valueOf(statusCode));

      logger.error(
          "Transcribe failed: chunk={}, attempts={}, permanent={}, status={}, message={}",
          chunkIndex,
          attempts,
          permanent,
          statusCode,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch started event. */
  public void logBatchStarted(int batchNumber, int totalBatches, int batchSize) {
    try {
      MDC.put("event_type", "batch_started");
      MDC.put("batchNumber", String.valueOf(batchNumber));
      MDC.put("totalBatches", String.valueOf(totalBatches));
      MDC.put("batchSize", String.valueOf(batchSize));

      logger.info(
          "Batch started: batch={}/{}, chunks={}, heapUsed={}MB",
          batchNumber,
          totalBatches,
          batchSize,
          usedHeapMb());
    } finally {
      clearEventFields();
    }
  }

  /** Log success rate computed by the gate. */
  public void logSuccessRate(int successful, int total, double required, double actual) {
    try {
      MDC.put("event_type", "success_rate");
      MDC.put("successfulChunks", String.valueOf(successful));
      MDC.put("totalChunks", String.valueOf(total));
      MDC.put("requiredRate", String.format("%.3f", required));
      MDC.put("actualRate", String.format("%.3f", actual));

      logger.info(
          "Success rate: {}/{} chunks, actual={}%, required={}%",
          successful,
          total,
          String.format("%.1f", actual * 100),
          String.format("%.1f", required * 100));
    } finally {
      clearEventFields();
    }
  }

  /** Log job state transition. */
  public void logJobState(String state) {
    try {
      MDC.put("event_type", "job_state");
      MDC.put("state", state);

      logger.info("Job state: {}", state);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String key) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("key", key);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("key");
  }

  private static long usedHeapMb() {
    Runtime runtime = Runtime.getRuntime();
    return (runtime.totalMemory() - runtime.freeMemory()) / 1024 / 1024;
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("startByte");
    MDC.remove("endByte");
    MDC.remove("segments");
    MDC.remove("durationSeconds");
    MDC.remove("attempts");
    MDC.remove("transcribeMs");
    MDC.remove("sizeBytes");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("failureClass");
    MDC.remove("statusCode");
    MDC.remove("backoffMs");
    MDC.remove("permanent");
    MDC.remove("batchNumber");
    MDC.remove("totalBatches");
    MDC.remove("batchSize");
    MDC.remove("successfulChunks");
    MDC.remove("totalChunks");
    MDC.remove("requiredRate");
    MDC.remove("actualRate");
    MDC.remove("state");
  }
}
