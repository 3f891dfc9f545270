package com.scholary.audio.segmenter.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audio.segmenter.api.TranscriptionRequest;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 60);

  @Test
  void findById_shouldReturnSavedJob() {
    TranscriptionJob job = job("a");
    repository.save(job);

    assertThat(repository.findById("a")).containsSame(job);
    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void trackState_shouldRecordTransitionsOnJob() {
    TranscriptionJob job = job("b");
    repository.save(job);

    repository.trackState(job).onStateChange(JobState.SEGMENTING);

    assertThat(repository.findById("b").orElseThrow().getState())
        .isEqualTo(JobState.SEGMENTING);
  }

  @Test
  void delete_shouldRemoveJob() {
    repository.save(job("c"));

    repository.delete("c");

    assertThat(repository.findById("c")).isEmpty();
  }

  private static TranscriptionJob job(String id) {
    return new TranscriptionJob(
        id, new TranscriptionRequest("in", "audio.mp3", "file.mp4", "out", null, null));
  }
}
