package com.scholary.jobrunner.job;

/**
 * Thrown when an operation is not allowed in the job's current status, e.g. cancelling a job that
 * already completed.
 */
public class InvalidStateTransitionException extends RuntimeException {

  private final String jobId;
  private final JobStatus currentStatus;

  public InvalidStateTransitionException(String jobId, JobStatus currentStatus, String message) {
    super(message);
    this.jobId = jobId;
    this.currentStatus = currentStatus;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getCurrentStatus() {
    return currentStatus;
  }
}
