package com.scholary.jobrunner.api;

import com.scholary.jobrunner.job.JobType;
import java.util.List;

/** The job types a client may request. */
public record JobTypesResponse(List<JobTypeInfo> types) {

  public static JobTypesResponse of(List<JobType> types) {
    return new JobTypesResponse(
        types.stream().map(type -> new JobTypeInfo(type.id(), type.description())).toList());
  }

  public record JobTypeInfo(String id, String description) {}
}
