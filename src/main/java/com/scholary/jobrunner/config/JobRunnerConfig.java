package com.scholary.jobrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.jobrunner.execution.ChildEnvironment;
import com.scholary.jobrunner.execution.JobCommandTable;
import com.scholary.jobrunner.execution.JobExecutor;
import com.scholary.jobrunner.execution.JsonOutputExtractor;
import com.scholary.jobrunner.job.JobRegistry;
import com.scholary.jobrunner.persistence.FileJobStore;
import com.scholary.jobrunner.persistence.JobStore;
import com.scholary.jobrunner.progress.ProgressParser;
import com.scholary.jobrunner.ratelimit.RateLimitCoordinator;
import com.scholary.jobrunner.ratelimit.RateLimitSignalDetector;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the job registry, its store and the executor.
 *
 * <p>Everything here is a process-wide singleton: one registry, one rate-limit window and one
 * executor shared by all requests.
 */
@Configuration
@EnableConfigurationProperties(JobRunnerProperties.class)
public class JobRunnerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // closed by the registry after its last write
  @Bean(destroyMethod = "")
  public JobStore jobStore(JobRunnerProperties properties, ObjectMapper objectMapper) {
    return new FileJobStore(Path.of(properties.dataDir()), objectMapper);
  }

  @Bean(destroyMethod = "close")
  public JobRegistry jobRegistry(JobStore jobStore, Clock clock) {
    return new JobRegistry(jobStore, clock);
  }

  @Bean
  public RateLimitCoordinator rateLimitCoordinator(Clock clock) {
    return new RateLimitCoordinator(clock);
  }

  @Bean
  public JobCommandTable jobCommandTable(JobRunnerProperties properties) {
    return new JobCommandTable(properties);
  }

  @Bean(destroyMethod = "close")
  public JobExecutor jobExecutor(
      JobRegistry jobRegistry,
      JobCommandTable jobCommandTable,
      RateLimitCoordinator rateLimitCoordinator,
      ObjectMapper objectMapper,
      JobRunnerProperties properties) {
    return new JobExecutor(
        jobRegistry,
        jobCommandTable,
        rateLimitCoordinator,
        new ProgressParser(),
        new RateLimitSignalDetector(),
        new JsonOutputExtractor(objectMapper),
        new ChildEnvironment(properties.childEnvWhitelist()),
        properties);
  }
}
