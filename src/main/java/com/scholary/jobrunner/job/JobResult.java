package com.scholary.jobrunner.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Terminal outcome of a job.
 *
 * <p>A failed job carries a result of the same shape as a completed one; callers branch on
 * {@link #success()}, never on which optional fields happen to be present.
 *
 * @param success true iff the job completed
 * @param output raw stdout of the process, if any
 * @param error diagnostic text for a failure
 * @param data structured payload extracted from the output
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(boolean success, String output, String error, JsonNode data) {

  public static JobResult succeeded() {
    return new JobResult(true, null, null, null);
  }

  public static JobResult succeeded(String output, JsonNode data) {
    return new JobResult(true, output, null, data);
  }

  public static JobResult failure(String error) {
    return new JobResult(false, null, error, null);
  }
}
