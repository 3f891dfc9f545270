package com.scholary.audio.segmenter.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription jobs.
 *
 * <p>Backed by a Caffeine cache bounded in size, with entries expiring a fixed time after their
 * last write. Jobs do not survive a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, TranscriptionJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(TranscriptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Listener that records each state change on the job and re-saves it, which also restarts the
   * job's expiry.
   */
  public JobStateListener trackState(TranscriptionJob job) {
    return state -> {
      job.setState(state);
      save(job);
    };
  }

  public long size() {
    return cache.estimatedSize();
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
