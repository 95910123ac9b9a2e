package com.scholary.jobrunner.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job execution.
 *
 * <p>Controls where job scripts run, where job history is stored, and how long and how often a
 * job may run.
 *
 * @param runtime executable that runs job scripts (e.g. {@code bun})
 * @param workingDir working directory of child processes
 * @param dataDir directory holding the job snapshot
 * @param timeoutOverride replaces every per-type timeout when set; clamped to two hours
 * @param killGracePeriod how long a timed-out process gets between SIGTERM and SIGKILL
 * @param maxRateLimitRetries extra attempts after a run fails on a rate limit
 * @param executorThreads worker pool size
 * @param executorQueueSize worker queue capacity
 * @param childEnvWhitelist environment variables passed through to child processes
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobRunnerProperties(
    @NotBlank String runtime,
    @NotBlank String workingDir,
    @NotBlank String dataDir,
    Duration timeoutOverride,
    @NotNull Duration killGracePeriod,
    @Min(0) int maxRateLimitRetries,
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    List<String> childEnvWhitelist) {

  public JobRunnerProperties {
    if (childEnvWhitelist == null) {
      childEnvWhitelist = List.of();
    }
  }
}
