package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.logging.MdcTaskDecorator;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code taskExecutor} runs whole jobs submitted through the API, {@code
 * chunkExecutor} runs the chunk transcriptions of a batch. They are separate so that a job waiting
 * on its batch never holds a thread its own chunks need. Chunk tasks inherit the job's MDC.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "chunkExecutor")
  public Executor chunkExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.chunkExecutorThreads());
    executor.setMaxPoolSize(properties.chunkExecutorThreads());
    executor.setThreadNamePrefix("chunk-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
