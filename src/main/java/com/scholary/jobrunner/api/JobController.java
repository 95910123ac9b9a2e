package com.scholary.jobrunner.api;

import com.scholary.jobrunner.job.Job;
import com.scholary.jobrunner.job.JobStatus;
import com.scholary.jobrunner.service.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for long-running jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating a job (returns the job id immediately)
 *   <li>Polling a job and listing jobs
 *   <li>Cancelling a job and deleting its record
 *   <li>Listing the available job types
 * </ul>
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Long-running job orchestration API")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobService jobService;

  public JobController(JobService jobService) {
    this.jobService = jobService;
  }

  @PostMapping
  @Operation(
      summary = "Create job",
      description = "Create a job and start it in the background. Poll the returned id for status.")
  public ResponseEntity<CreateJobResponse> createJob(@Valid @RequestBody CreateJobRequest request) {
    LOGGER.info("Create job request: type={}", request.type());
    String jobId = jobService.createJob(request.type(), request.options());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new CreateJobResponse(
                jobId,
                request.type(),
                JobStatus.PENDING.wireName(),
                "Job created successfully"));
  }

  @GetMapping
  @Operation(summary = "List jobs", description = "List jobs in creation order")
  public JobListResponse listJobs(
      @RequestParam(required = false) String status, @RequestParam(required = false) String type) {
    JobStatus statusFilter = status == null ? null : JobStatus.fromWireName(status);
    return JobListResponse.of(jobService.listJobs(statusFilter, type));
  }

  @GetMapping("/types")
  @Operation(summary = "List job types")
  public JobTypesResponse jobTypes() {
    return JobTypesResponse.of(jobService.jobTypes());
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get job", description = "Current status, progress and result of a job")
  public ResponseEntity<Job> getJob(@PathVariable String jobId) {
    return jobService
        .getJob(jobId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{jobId}")
  @Operation(
      summary = "Cancel job",
      description = "Cancel a pending or running job. Finished jobs cannot be cancelled.")
  public ResponseEntity<CancelJobResponse> cancelJob(@PathVariable String jobId) {
    return jobService
        .cancelJob(jobId)
        .map(
            job ->
                ResponseEntity.ok(
                    new CancelJobResponse(
                        job.id(), job.status().wireName(), "Job cancelled successfully")))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{jobId}/record")
  @Operation(summary = "Delete job record", description = "Forget a job and its result")
  public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
    if (!jobService.deleteJob(jobId)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.noContent().build();
  }
}
