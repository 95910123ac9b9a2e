package com.scholary.jobrunner.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Immutable snapshot of a tracked job.
 *
 * <p>The registry replaces the whole record on every mutation, so a {@code Job} handed out to a
 * caller never changes underneath it. {@code type} is kept as the raw type id rather than
 * {@link JobType} so the registry can also track ad hoc types.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String id,
    String type,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    JobProgress progress,
    JobResult result) {

  static Job pending(String id, String type, Instant createdAt) {
    return new Job(id, type, JobStatus.PENDING, createdAt, null, null, null, null);
  }

  Job withStatus(JobStatus newStatus, Instant startedAt, Instant completedAt, JobResult result) {
    return new Job(id, type, newStatus, createdAt, startedAt, completedAt, progress, result);
  }

  Job withProgress(JobProgress newProgress) {
    return new Job(id, type, status, createdAt, startedAt, completedAt, newProgress, result);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
