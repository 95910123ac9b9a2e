package com.scholary.jobrunner.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of a job.
 *
 * <pre>
 * pending ──► running ──► completed
 *    │           │
 *    └───────────┴──────► failed
 * </pre>
 *
 * <p>A pending job may fail directly (unknown type, spawn failure, cancellation before start).
 * Terminal states never transition anywhere else.
 */
public enum JobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Whether moving from this status to {@code next} is allowed.
   *
   * <p>Re-entering the current status is allowed (running → running, or the same terminal status
   * twice) so that repeated updates stay idempotent.
   */
  public boolean canTransitionTo(JobStatus next) {
    if (next == this) {
      return true;
    }
    return switch (this) {
      case PENDING -> next == RUNNING || next == FAILED;
      case RUNNING -> next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @throws IllegalArgumentException if {@code value} names no status
   */
  @JsonCreator
  public static JobStatus fromWireName(String value) {
    for (JobStatus status : values()) {
      if (status.wireName().equalsIgnoreCase(value == null ? "" : value.trim())) {
        return status;
      }
    }
    throw new IllegalArgumentException("Invalid job status: " + value);
  }
}
