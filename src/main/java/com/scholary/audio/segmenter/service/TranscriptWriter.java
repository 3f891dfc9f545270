package com.scholary.audio.segmenter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.objectstore.ObjectStoreClient;
import com.scholary.audio.segmenter.topics.TopicAnalysis;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes transcription results to the output bucket.
 *
 * <p>Two JSON documents, named after the original file ({@code lecture-01.mp4} becomes {@code
 * lecture-01}):
 *
 * <ul>
 *   <li>{@code transcription/{base}.json}, always
 *   <li>{@code topics/{base}.json}, only when topic segmentation succeeded
 * </ul>
 *
 * <p>Both objects carry the request's catalogue fields as user metadata.
 */
@Component
public class TranscriptWriter {

  static final String CONTENT_TYPE = "application/json";
  static final String DETECTION_METHOD = "whisper_timestamps_llm_analysis";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptWriter.class);

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;

  public TranscriptWriter(ObjectMapper objectMapper, ObjectStoreClient objectStoreClient) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
  }

  /** Keys of the stored documents. {@code topicsKey} is null when no topics were written. */
  public record StoredKeys(String transcriptionKey, String topicsKey) {}

  /**
   * Write transcription JSON.
   *
   * <pre>
   * {
   *   "transcription": "Buenos días a todos...",
   *   "metadata": {"original_file": "...", "audio_file": "...", "processed_at": "..."},
   *   "debug": {"chunks_processed": 3, "total_segments": 41}
   * }
   * </pre>
   */
  public byte[] writeTranscriptionJson(TranscriptionRequest request, TranscriptionResult result)
      throws IOException {
    Map<String, Object> debug = new LinkedHashMap<>();
    debug.put("chunks_processed", result.transcriptionResults().size());
    debug.put("total_segments", result.totalSegments());

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("transcription", result.transcription());
    document.put("metadata", fileInfo(request));
    document.put("debug", debug);

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Write topics JSON.
   *
   * <pre>
   * {
   *   "topicSegments": [{"startTime": "00:00", "endTime": "03:10", "topic": "...", ...}],
   *   "segmentationMetadata": {
   *     "totalSegments": 4, "averageSegmentDuration": 95,
   *     "detectionMethod": "...", "analysisError": null
   *   },
   *   "metadata": {...}
   * }
   * </pre>
   */
  public byte[] writeTopicsJson(TranscriptionRequest request, TranscriptionResult result)
      throws IOException {
    TopicAnalysis analysis = result.topicAnalysis();

    Map<String, Object> segmentation = new LinkedHashMap<>();
    segmentation.put("totalSegments", analysis.segments().size());
    segmentation.put("averageSegmentDuration", analysis.averageSegmentDurationSeconds());
    segmentation.put("detectionMethod", DETECTION_METHOD);
    segmentation.put("analysisError", result.analysisError());

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("topicSegments", analysis.segments());
    document.put("segmentationMetadata", segmentation);
    document.put("metadata", fileInfo(request));

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Save the result documents to the request's output bucket.
   *
   * @return the keys written
   */
  public StoredKeys saveResults(TranscriptionRequest request, TranscriptionResult result)
      throws IOException {
    String baseName = baseName(request.fileKey());
    Map<String, String> metadata = objectMetadata(request);

    String transcriptionKey = "transcription/" + baseName + ".json";
    put(request.outputBucket(), transcriptionKey, writeTranscriptionJson(request, result), metadata);

    String topicsKey = null;
    if (result.segmentationCompleted()) {
      topicsKey = "topics/" + baseName + ".json";
      put(request.outputBucket(), topicsKey, writeTopicsJson(request, result), metadata);
    } else {
      LOGGER.warn("No topics to save: {}", result.analysisError());
    }

    return new StoredKeys(transcriptionKey, topicsKey);
  }

  private void put(String bucket, String key, byte[] body, Map<String, String> metadata) {
    objectStoreClient.putObject(
        bucket, key, new ByteArrayInputStream(body), body.length, CONTENT_TYPE, metadata);
    LOGGER.info("Saved {} bytes to {}/{}", body.length, bucket, key);
  }

  private static Map<String, Object> fileInfo(TranscriptionRequest request) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("original_file", request.fileKey());
    info.put("audio_file", request.audioKey());
    info.put("processed_at", Instant.now().toString());
    return info;
  }

  /** S3 user metadata; keys are lower case, missing values are empty strings. */
  static Map<String, String> objectMetadata(TranscriptionRequest request) {
    TranscriptionRequest.ContentMetadata content = request.metadata();
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("contentid", orEmpty(content.contentId()));
    metadata.put("type", orEmpty(content.type()));
    metadata.put("title", orEmpty(content.title()));
    metadata.put("parentid", orEmpty(content.parentId()));
    metadata.put(
        "orderindex", String.valueOf(content.orderIndex() != null ? content.orderIndex() : 0));
    metadata.put("fileextension", orEmpty(request.fileExtension()));
    metadata.put("originalobjectkey", request.fileKey());
    metadata.put("audiokey", request.audioKey());
    return metadata;
  }

  /** Last path element of the key, up to its first dot. */
  static String baseName(String fileKey) {
    String name = fileKey.substring(fileKey.lastIndexOf('/') + 1);
    int dot = name.indexOf('.');
    return dot >= 0 ? name.substring(0, dot) : name;
  }

  private static String orEmpty(String value) {
    return value != null ? value : "";
  }
}
