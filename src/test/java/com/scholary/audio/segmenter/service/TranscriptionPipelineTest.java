package com.scholary.audio.segmenter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.audio.segmenter.api.TranscriptionRequest;
import com.scholary.audio.segmenter.api.TranscriptionResponse;
import com.scholary.audio.segmenter.chunking.ChunkConfig;
import com.scholary.audio.segmenter.config.TranscriptionProperties;
import com.scholary.audio.segmenter.job.JobStateListener;
import com.scholary.audio.segmenter.objectstore.ObjectStoreClient;
import com.scholary.audio.segmenter.objectstore.ObjectStoreException;
import com.scholary.audio.segmenter.topics.TopicAnalysis;
import com.scholary.audio.segmenter.topics.TopicSegment;
import com.scholary.audio.segmenter.transcript.Timeline;
import com.scholary.audio.segmenter.transcription.InsufficientSuccessRateException;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionPipelineTest {

  @Mock private ObjectStoreClient objectStoreClient;
  @Mock private TranscriptionEngine engine;
  @Mock private TranscriptWriter transcriptWriter;

  @TempDir Path tempDir;

  private TranscriptionPipeline pipeline;

  private final TranscriptionRequest request =
      new TranscriptionRequest(
          "audio-bucket", "audio/talk.mp3", "uploads/talk.mp4", "output-bucket", null, "mp4");

  @BeforeEach
  void setUp() {
    TranscriptionProperties properties =
        new TranscriptionProperties(
            new TranscriptionProperties.ChunkingProperties(4_000, 5, 4096),
            new TranscriptionProperties.RetryProperties(3, 2000, 1000),
            tempDir.toString(),
            true,
            2,
            10,
            4);
    pipeline = new TranscriptionPipeline(objectStoreClient, engine, transcriptWriter, properties);
  }

  @Test
  void process_shouldDownloadTranscribeSaveAndCleanUp() throws Exception {
    when(objectStoreClient.getObjectStream("audio-bucket", "audio/talk.mp3"))
        .thenReturn(new ByteArrayInputStream(new byte[10_000]));
    when(engine.transcribe(any(Path.class), any(ChunkConfig.class), eq(JobStateListener.NO_OP)))
        .thenAnswer(
            invocation -> {
              Path audio = invocation.getArgument(0);
              ChunkConfig config = invocation.getArgument(1);
              assertThat(Files.size(audio)).isEqualTo(10_000);
              assertThat(config.chunkSizeBytes()).isEqualTo(4_000);
              assertThat(config.concurrentRequests()).isEqualTo(3);
              return result();
            });
    when(transcriptWriter.saveResults(eq(request), any(TranscriptionResult.class)))
        .thenReturn(new TranscriptWriter.StoredKeys("transcription/talk.json", "topics/talk.json"));

    TranscriptionResponse response = pipeline.process(request, JobStateListener.NO_OP);

    assertThat(response.transcription()).isEqualTo("hola");
    assertThat(response.topicSegments()).hasSize(1);
    assertThat(response.segmentationCompleted()).isTrue();
    assertThat(response.transcriptionKey()).isEqualTo("transcription/talk.json");
    assertThat(response.topicsKey()).isEqualTo("topics/talk.json");
    assertThat(response.diagnostics().totalDurationSeconds()).isEqualTo(60.0);
    assertThat(listTempDir()).isEmpty();
  }

  @Test
  void process_shouldDeleteTempFileWhenEngineFails() throws Exception {
    when(objectStoreClient.getObjectStream("audio-bucket", "audio/talk.mp3"))
        .thenReturn(new ByteArrayInputStream(new byte[10_000]));
    when(engine.transcribe(any(Path.class), any(ChunkConfig.class), any()))
        .thenThrow(new InsufficientSuccessRateException(3, 1, 3));

    assertThatThrownBy(() -> pipeline.process(request, JobStateListener.NO_OP))
        .isInstanceOf(InsufficientSuccessRateException.class);
    assertThat(listTempDir()).isEmpty();
    verify(transcriptWriter, never()).saveResults(any(), any());
  }

  @Test
  void process_shouldPropagateDownloadFailure() throws Exception {
    when(objectStoreClient.getObjectStream("audio-bucket", "audio/talk.mp3"))
        .thenThrow(new ObjectStoreException("Object not found"));

    assertThatThrownBy(() -> pipeline.process(request, JobStateListener.NO_OP))
        .isInstanceOf(ObjectStoreException.class);
    assertThat(listTempDir()).isEmpty();
    verify(engine, never()).transcribe(any(), any(), any());
  }

  private List<Path> listTempDir() throws Exception {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.toList();
    }
  }

  private static TranscriptionResult result() {
    return new TranscriptionResult(
        "hola",
        List.of(),
        new TopicAnalysis(List.of(new TopicSegment("00:00", "01:00", "Saludo", "Inicio"))),
        null,
        new Timeline(List.of(), 60.0),
        new TranscriptionResult.ChunkStats(3, 3, 3, 0, List.of()));
  }
}
