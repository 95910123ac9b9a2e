package com.scholary.jobrunner.api;

import com.scholary.jobrunner.execution.JobOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/** Request to create a job. */
public record CreateJobRequest(
    @Schema(description = "Job type id", example = "notion:fetch-all") @NotBlank String type,
    @Schema(description = "Optional job options") JobOptions options) {}
