package com.scholary.jobrunner.api;

import com.scholary.jobrunner.job.Job;
import java.util.List;

public record JobListResponse(List<Job> jobs, int count) {

  public static JobListResponse of(List<Job> jobs) {
    return new JobListResponse(jobs, jobs.size());
  }
}
