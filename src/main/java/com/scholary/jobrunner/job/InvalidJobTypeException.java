package com.scholary.jobrunner.job;

/** Thrown when a caller asks for a job type outside the closed {@link JobType} set. */
public class InvalidJobTypeException extends RuntimeException {

  private final String requestedType;

  public InvalidJobTypeException(String requestedType) {
    super(
        String.format(
            "Invalid job type: %s. Valid types: %s", requestedType, JobType.availableIds()));
    this.requestedType = requestedType;
  }

  public String getRequestedType() {
    return requestedType;
  }
}
