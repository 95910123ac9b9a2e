package com.scholary.jobrunner.job;

/** Last progress observation of a running job. */
public record JobProgress(long current, long total, String message) {}
