package com.scholary.tracklist.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code taskExecutor} runs whole identification jobs, {@code
 * segmentExecutor} runs the per-segment provider calls of all jobs. Each run additionally caps its
 * own in-flight segments at {@code maxConcurrentSegments}.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(TracklistProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("tracklist-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "segmentExecutor")
  public Executor segmentExecutor(TracklistProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.segmentExecutorThreads());
    executor.setMaxPoolSize(properties.segmentExecutorThreads());
    executor.setThreadNamePrefix("tracklist-segment-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
