package com.scholary.audio.segmenter.service;

import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.api.TranscriptionResponse;
import com.scholary.audio.segmenter.chunking.ChunkConfig;
import com.scholary.audio.segmenter.config.TranscriptionProperties;
import com.scholary.audio.segmenter.job.JobStateListener;
import com.scholary.audio.segmenter.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * End-to-end processing of a stored audio object.
 *
 * <p>Downloads the audio to a temporary file, runs the engine on it, saves the result documents
 * and removes the temporary file again, whatever the outcome.
 */
@Service
public class TranscriptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);

  private final ObjectStoreClient objectStoreClient;
  private final TranscriptionEngine engine;
  private final TranscriptWriter transcriptWriter;
  private final TranscriptionProperties properties;
  private final Path tempDir;

  public TranscriptionPipeline(
      ObjectStoreClient objectStoreClient,
      TranscriptionEngine engine,
      TranscriptWriter transcriptWriter,
      TranscriptionProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.engine = engine;
    this.transcriptWriter = transcriptWriter;
    this.properties = properties;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
  }

  public TranscriptionResponse process(TranscriptionRequest request, JobStateListener listener)
      throws IOException {
    Path audioPath = download(request.audioBucket(), request.audioKey());
    try {
      long size = Files.size(audioPath);
      TranscriptionProperties.ChunkingProperties chunking = properties.chunking();
      ChunkConfig config =
          ChunkConfig.forAudioSize(
              size, chunking.chunkSizeBytes(), chunking.maxConcurrentRequests());

      TranscriptionResult result = engine.transcribe(audioPath, config, listener);
      TranscriptWriter.StoredKeys keys = transcriptWriter.saveResults(request, result);
      return toResponse(result, keys);

    } finally {
      try {
        Files.deleteIfExists(audioPath);
        LOGGER.debug("Deleted temp file: {}", audioPath);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete temp file: {}", audioPath, e);
      }
    }
  }

  private Path download(String bucket, String key) throws IOException {
    Path target = Files.createTempFile(tempDir, "audio-", suffix(key));
    LOGGER.info("Downloading {}/{} to {}", bucket, key, target);
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, key)) {
      long bytes = Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded {} MB", bytes / 1024 / 1024);
      return target;
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(target);
      throw e;
    }
  }

  private static String suffix(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot) : ".audio";
  }

  private static TranscriptionResponse toResponse(
      TranscriptionResult result, TranscriptWriter.StoredKeys keys) {
    TranscriptionResult.ChunkStats stats = result.stats();
    return new TranscriptionResponse(
        result.transcription(),
        result.segmentationCompleted() ? result.topicAnalysis().segments() : null,
        result.segmentationCompleted(),
        result.analysisError(),
        keys.transcriptionKey(),
        keys.topicsKey(),
        new TranscriptionResponse.Diagnostics(
            stats.plannedChunks(),
            stats.submittedChunks(),
            stats.successfulChunks(),
            stats.droppedChunks(),
            stats.exhaustedChunkIndices(),
            result.timeline().totalDurationSeconds()));
  }
}
