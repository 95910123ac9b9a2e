package com.scholary.jobrunner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for job execution threads.
 *
 * <p>Each job occupies one pool thread for as long as its process runs, so the pool size is the
 * number of jobs that can run at once. Jobs beyond that wait in the queue; once the queue is full
 * the pool rejects them.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobTaskExecutor")
  public ThreadPoolTaskExecutor jobTaskExecutor(JobRunnerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
