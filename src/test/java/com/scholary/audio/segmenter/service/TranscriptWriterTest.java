package com.scholary.audio.segmenter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.objectstore.ObjectStoreClient;
import com.scholary.audio.segmenter.topics.TopicAnalysis;
import com.scholary.audio.segmenter.topics.TopicSegment;
import com.scholary.audio.segmenter.transcript.Timeline;
import com.scholary.audio.segmenter.transcription.ChunkResult;
import com.scholary.audio.segmenter.whisper.TranscriptSegment;
import com.scholary.audio.segmenter.whisper.WhisperResponse;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptWriterTest {

  @Mock private ObjectStoreClient objectStoreClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TranscriptWriter writer;

  private final TranscriptionRequest request =
      new TranscriptionRequest(
          "audio-bucket",
          "audio/lecture-01.mp3",
          "uploads/2024/lecture-01.final.mp4",
          "output-bucket",
          new TranscriptionRequest.ContentMetadata("c-42", "lecture", "Historia", "p-7", 3),
          null);

  @BeforeEach
  void setUp() {
    writer = new TranscriptWriter(objectMapper, objectStoreClient);
  }

  @Test
  void writeTranscriptionJson_shouldIncludeTextFileInfoAndCounts() throws Exception {
    JsonNode json = objectMapper.readTree(writer.writeTranscriptionJson(request, result(true)));

    assertThat(json.path("transcription").asText()).isEqualTo("Hola a todos");
    assertThat(json.path("metadata").path("original_file").asText())
        .isEqualTo("uploads/2024/lecture-01.final.mp4");
    assertThat(json.path("metadata").path("audio_file").asText())
        .isEqualTo("audio/lecture-01.mp3");
    assertThat(json.path("metadata").path("processed_at").asText()).isNotBlank();
    assertThat(json.path("debug").path("chunks_processed").asInt()).isEqualTo(2);
    assertThat(json.path("debug").path("total_segments").asInt()).isEqualTo(3);
  }

  @Test
  void writeTopicsJson_shouldIncludeSegmentsAndAverageDuration() throws Exception {
    JsonNode json = objectMapper.readTree(writer.writeTopicsJson(request, result(true)));

    assertThat(json.path("topicSegments")).hasSize(2);
    assertThat(json.path("topicSegments").get(0).path("topic").asText()).isEqualTo("Saludo");
    JsonNode segmentation = json.path("segmentationMetadata");
    assertThat(segmentation.path("totalSegments").asInt()).isEqualTo(2);
    assertThat(segmentation.path("averageSegmentDuration").asLong()).isEqualTo(45);
    assertThat(segmentation.path("detectionMethod").asText())
        .isEqualTo(TranscriptWriter.DETECTION_METHOD);
    assertThat(segmentation.path("analysisError").isNull()).isTrue();
  }

  @Test
  void saveResults_shouldWriteBothDocumentsWithObjectMetadata() throws Exception {
    TranscriptWriter.StoredKeys keys = writer.saveResults(request, result(true));

    assertThat(keys.transcriptionKey()).isEqualTo("transcription/lecture-01.json");
    assertThat(keys.topicsKey()).isEqualTo("topics/lecture-01.json");

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> metadata = ArgumentCaptor.forClass(Map.class);
    verify(objectStoreClient)
        .putObject(
            eq("output-bucket"),
            eq("transcription/lecture-01.json"),
            any(InputStream.class),
            anyLong(),
            eq("application/json"),
            metadata.capture());
    verify(objectStoreClient)
        .putObject(
            eq("output-bucket"),
            eq("topics/lecture-01.json"),
            any(InputStream.class),
            anyLong(),
            eq("application/json"),
            anyMap());

    assertThat(metadata.getValue())
        .containsEntry("contentid", "c-42")
        .containsEntry("type", "lecture")
        .containsEntry("title", "Historia")
        .containsEntry("parentid", "p-7")
        .containsEntry("orderindex", "3")
        .containsEntry("fileextension", "mp4")
        .containsEntry("originalobjectkey", "uploads/2024/lecture-01.final.mp4")
        .containsEntry("audiokey", "audio/lecture-01.mp3");
  }

  @Test
  void saveResults_shouldSkipTopicsWhenSegmentationFellBack() throws Exception {
    TranscriptWriter.StoredKeys keys = writer.saveResults(request, result(false));

    assertThat(keys.topicsKey()).isNull();
    verify(objectStoreClient, never())
        .putObject(any(), eq("topics/lecture-01.json"), any(), anyLong(), any(), anyMap());
  }

  @Test
  void objectMetadata_shouldDefaultMissingFields() {
    TranscriptionRequest bare =
        new TranscriptionRequest("a", "audio.mp3", "video.mov", "out", null, null);

    assertThat(TranscriptWriter.objectMetadata(bare))
        .containsEntry("contentid", "")
        .containsEntry("title", "")
        .containsEntry("orderindex", "0")
        .containsEntry("fileextension", "mov");
  }

  @Test
  void baseName_shouldTakeLastPathElementUpToFirstDot() {
    assertThat(TranscriptWriter.baseName("a/b/talk.v2.mp4")).isEqualTo("talk");
    assertThat(TranscriptWriter.baseName("talk")).isEqualTo("talk");
  }

  private static TranscriptionResult result(boolean withTopics) {
    List<ChunkResult> chunks =
        List.of(
            ChunkResult.success(
                0,
                new WhisperResponse(
                    "Hola a",
                    List.of(new TranscriptSegment(0, 1, "Hola"), new TranscriptSegment(1, 2, "a")),
                    45,
                    "es"),
                1),
            ChunkResult.success(
                1,
                new WhisperResponse("todos", List.of(new TranscriptSegment(0, 1, "todos")), 45, "es"),
                2));
    TopicAnalysis topics =
        withTopics
            ? new TopicAnalysis(
                List.of(
                    new TopicSegment("00:00", "00:40", "Saludo", "Inicio"),
                    new TopicSegment("00:40", "01:30", "Tema", "Contenido")))
            : null;
    return new TranscriptionResult(
        "Hola a todos",
        chunks,
        topics,
        withTopics ? null : "timeout",
        new Timeline(List.of(), 90),
        new TranscriptionResult.ChunkStats(2, 2, 2, 0, List.of()));
  }
}
