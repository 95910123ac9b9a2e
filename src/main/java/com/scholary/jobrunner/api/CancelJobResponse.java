package com.scholary.jobrunner.api;

public record CancelJobResponse(String jobId, String status, String message) {}
