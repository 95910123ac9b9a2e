package com.scholary.jobrunner.api;

/** Response for an accepted job: the id to poll and its initial status. */
public record CreateJobResponse(String jobId, String type, String status, String message) {}
