package com.scholary.audio.segmenter.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.audio.segmenter.chunking.ChunkSpec;
import com.scholary.audio.segmenter.config.AsyncConfig;
import com.scholary.audio.segmenter.config.TranscriptionProperties;
import com.scholary.audio.segmenter.whisper.TranscriptSegment;
import com.scholary.audio.segmenter.whisper.WhisperResponse;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class BatchSchedulerTest {

  private static final Path AUDIO = Path.of("audio.mp3");

  @Mock private ChunkTranscriber chunkTranscriber;

  private ExecutorService executor;
  private BatchScheduler scheduler;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    scheduler = new BatchScheduler(chunkTranscriber, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void schedule_shouldStoreResultsByChunkIndex() {
    List<ChunkSpec> chunks = chunks(5);
    for (ChunkSpec chunk : chunks) {
      when(chunkTranscriber.process(AUDIO, chunk)).thenReturn(Optional.of(success(chunk.index())));
    }

    BatchOutcome outcome = scheduler.schedule(AUDIO, chunks, 2);

    assertThat(outcome.results()).hasSize(5);
    for (int i = 0; i < 5; i++) {
      assertThat(outcome.results().get(i).index()).isEqualTo(i);
    }
    assertThat(outcome.successfulChunks()).isEqualTo(5);
    assertThat(outcome.exhaustedChunks()).isEmpty();
  }

  @Test
  void schedule_shouldCollectAllResultsWhenSiblingsFail() {
    List<ChunkSpec> chunks = chunks(3);
    when(chunkTranscriber.process(AUDIO, chunks.get(0))).thenReturn(Optional.of(success(0)));
    when(chunkTranscriber.process(AUDIO, chunks.get(1)))
        .thenReturn(Optional.of(ChunkResult.retriesExhausted(1, 4, "server error")));
    when(chunkTranscriber.process(AUDIO, chunks.get(2))).thenReturn(Optional.of(success(2)));

    BatchOutcome outcome = scheduler.schedule(AUDIO, chunks, 3);

    assertThat(outcome.submittedChunks()).isEqualTo(3);
    assertThat(outcome.successfulChunks()).isEqualTo(2);
    assertThat(outcome.failedChunks()).isEqualTo(1);
    assertThat(outcome.exhaustedChunks()).containsExactly(chunks.get(1));
  }

  @Test
  void schedule_shouldLeaveDroppedChunksOutOfTheCounts() {
    List<ChunkSpec> chunks = chunks(2);
    when(chunkTranscriber.process(AUDIO, chunks.get(0))).thenReturn(Optional.of(success(0)));
    when(chunkTranscriber.process(AUDIO, chunks.get(1))).thenReturn(Optional.empty());

    BatchOutcome outcome = scheduler.schedule(AUDIO, chunks, 2);

    assertThat(outcome.results().get(1)).isNull();
    assertThat(outcome.submittedChunks()).isEqualTo(1);
    assertThat(outcome.droppedChunks()).isEqualTo(1);
  }

  @Test
  void schedule_shouldTurnUnexpectedTaskFailureIntoPermanentResult() {
    List<ChunkSpec> chunks = chunks(1);
    when(chunkTranscriber.process(eq(AUDIO), any())).thenThrow(new IllegalStateException("bug"));

    BatchOutcome outcome = scheduler.schedule(AUDIO, chunks, 1);

    assertThat(outcome.results().get(0).outcome()).isEqualTo(ChunkOutcome.FAILED_PERMANENT);
  }

  @Test
  void schedule_shouldNeverRunMoreThanConcurrencyChunksAtOnce() {
    List<ChunkSpec> chunks = chunks(7);
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    when(chunkTranscriber.process(eq(AUDIO), any()))
        .thenAnswer(
            invocation -> {
              int now = inFlight.incrementAndGet();
              maxInFlight.accumulateAndGet(now, Math::max);
              Thread.sleep(20);
              inFlight.decrementAndGet();
              ChunkSpec chunk = invocation.getArgument(1);
              return Optional.of(success(chunk.index()));
            });

    BatchOutcome outcome = scheduler.schedule(AUDIO, chunks, 2);

    assertThat(outcome.successfulChunks()).isEqualTo(7);
    assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
  }

  @Test
  void schedule_shouldCarryJobContextOntoChunkThreads() {
    TranscriptionProperties properties =
        new TranscriptionProperties(
            new TranscriptionProperties.ChunkingProperties(4_000, 5, 4096),
            new TranscriptionProperties.RetryProperties(3, 2000, 1000),
            "/tmp",
            true,
            1,
            10,
            2);
    ThreadPoolTaskExecutor chunkExecutor =
        (ThreadPoolTaskExecutor) new AsyncConfig().chunkExecutor(properties);
    BatchScheduler contextScheduler = new BatchScheduler(chunkTranscriber, chunkExecutor);
    List<ChunkSpec> chunks = chunks(3);
    Map<Integer, String> jobIds = new ConcurrentHashMap<>();
    Map<Integer, String> correlationIds = new ConcurrentHashMap<>();
    when(chunkTranscriber.process(eq(AUDIO), any()))
        .thenAnswer(
            invocation -> {
              ChunkSpec chunk = invocation.getArgument(1);
              assertThat(Thread.currentThread().getName()).startsWith("chunk-");
              jobIds.put(chunk.index(), String.valueOf(MDC.get("jobId")));
              correlationIds.put(chunk.index(), String.valueOf(MDC.get("correlationId")));
              return Optional.of(success(chunk.index()));
            });

    MDC.put("jobId", "job-42");
    MDC.put("correlationId", "corr-7");
    try {
      contextScheduler.schedule(AUDIO, chunks, 2);
    } finally {
      MDC.clear();
      chunkExecutor.shutdown();
    }

    assertThat(jobIds).hasSize(3);
    assertThat(jobIds.values()).containsOnly("job-42");
    assertThat(correlationIds.values()).containsOnly("corr-7");
  }

  @Test
  void schedule_shouldRejectNonPositiveConcurrency() {
    assertThatThrownBy(() -> scheduler.schedule(AUDIO, chunks(1), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<ChunkSpec> chunks(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new ChunkSpec(i, i * 10_000L, (i + 1) * 10_000L))
        .toList();
  }

  private static ChunkResult success(int index) {
    return ChunkResult.success(
        index,
        new WhisperResponse(
            "chunk " + index, List.of(new TranscriptSegment(0, 1, "chunk " + index)), 10, "es"),
        1);
  }
}
