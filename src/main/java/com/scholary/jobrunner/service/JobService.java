package com.scholary.jobrunner.service;

import com.scholary.jobrunner.execution.JobExecutor;
import com.scholary.jobrunner.execution.JobOptions;
import com.scholary.jobrunner.job.Job;
import com.scholary.jobrunner.job.JobRegistry;
import com.scholary.jobrunner.job.JobResult;
import com.scholary.jobrunner.job.JobStatus;
import com.scholary.jobrunner.job.JobType;
import com.scholary.jobrunner.logging.JobEventLogger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for job operations.
 *
 * <p>Creating a job returns as soon as the pending record exists; the job itself runs on the job
 * thread pool.
 */
@Service
public class JobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);
  private static final JobEventLogger EVENTS = new JobEventLogger(LOGGER);

  static final String QUEUE_FULL_ERROR = "Job queue is full";

  private final JobRegistry registry;
  private final JobExecutor executor;
  private final TaskExecutor taskExecutor;

  public JobService(
      JobRegistry registry,
      JobExecutor executor,
      @Qualifier("jobTaskExecutor") TaskExecutor taskExecutor) {
    this.registry = registry;
    this.executor = executor;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Create a job and schedule it.
   *
   * @return the new job id
   * @throws com.scholary.jobrunner.job.InvalidJobTypeException if {@code type} is unknown
   */
  public String createJob(String type, JobOptions options) {
    JobType jobType = JobType.fromId(type);
    String jobId = registry.createJob(jobType.id());
    EVENTS.logJobCreated(jobId, jobType.id());

    try {
      taskExecutor.execute(() -> executor.execute(jobId, jobType.id(), options));
    } catch (TaskRejectedException e) {
      LOGGER.error("Job pool rejected job {}: {}", jobId, e.getMessage());
      registry.updateStatus(jobId, JobStatus.FAILED, JobResult.failure(QUEUE_FULL_ERROR));
    }
    return jobId;
  }

  public Optional<Job> getJob(String id) {
    return registry.getJob(id);
  }

  /**
   * List jobs in creation order, optionally narrowed by status and type.
   *
   * @param status status filter, null for any
   * @param type type id filter, null for any
   */
  public List<Job> listJobs(JobStatus status, String type) {
    return registry.getAllJobs().stream()
        .filter(job -> status == null || job.status() == status)
        .filter(job -> type == null || job.type().equals(type))
        .toList();
  }

  /**
   * Cancel a pending or running job and stop its process.
   *
   * @return the cancelled job, or empty if the id is unknown
   * @throws com.scholary.jobrunner.job.InvalidStateTransitionException if the job already finished
   */
  public Optional<Job> cancelJob(String id) {
    Optional<Job> cancelled = registry.cancel(id);
    cancelled.ifPresent(
        job -> {
          boolean stopped = executor.terminate(id);
          LOGGER.info("Cancelled job {} (process running: {})", id, stopped);
        });
    return cancelled;
  }

  /** Remove a job record. A running job keeps running but is no longer tracked. */
  public boolean deleteJob(String id) {
    return registry.deleteJob(id);
  }

  public List<JobType> jobTypes() {
    return Arrays.asList(JobType.values());
  }
}
