package com.scholary.jobrunner.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging for job lifecycle events.
 *
 * <p>Each event puts its fields into the MDC for the duration of the log call so they can be
 * queried as structured fields in the log pipeline, then removes them again.
 */
public class JobEventLogger {

  private final Logger logger;

  public JobEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job created event. */
  public void logJobCreated(String jobId, String jobType) {
    try {
      MDC.put("event_type", "job_created");
      MDC.put("jobId", jobId);
      MDC.put("jobType", jobType);

      logger.info("Job created: jobId={}, type={}", jobId, jobType);
    } finally {
      clearEventFields();
      clearJobContext();
    }
  }

  /** Log process started event. */
  public void logJobStarted(String jobId, List<String> commandLine, int attempt) {
    try {
      MDC.put("event_type", "job_started");
      MDC.put("attempt", String.valueOf(attempt));

      logger.info(
          "Job started: jobId={}, attempt={}, command={}",
          jobId,
          attempt,
          String.join(" ", commandLine));
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, long current, long total) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("current", String.valueOf(current));
      MDC.put("total", String.valueOf(total));

      logger.debug("Job progress: jobId={}, progress={}/{}", jobId, current, total);
    } finally {
      clearEventFields();
    }
  }

  /** Log rate limit signal seen in process output. */
  public void logRateLimitSignal(String jobId, double retryAfterSeconds) {
    try {
      MDC.put("event_type", "rate_limit_signal");
      if (Double.isFinite(retryAfterSeconds)) {
        MDC.put("retryAfterSeconds", String.valueOf(retryAfterSeconds));
      }

      logger.warn(
          "Rate limit reported by job process: jobId={}, retryAfter={}",
          jobId,
          Double.isFinite(retryAfterSeconds) ? retryAfterSeconds + "s" : "none");
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(String jobId, String status, Integer exitCode, long durationMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("durationMs", String.valueOf(durationMs));
      if (exitCode != null) {
        MDC.put("exitCode", String.valueOf(exitCode));
      }

      if ("completed".equals(status)) {
        logger.info(
            "Job finished: jobId={}, status={}, exitCode={}, duration={}ms",
            jobId,
            status,
            exitCode,
            durationMs);
      } else {
        logger.error(
            "Job finished: jobId={}, status={}, exitCode={}, duration={}ms",
            jobId,
            status,
            exitCode,
            durationMs);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String jobType) {
    MDC.put("jobId", jobId);
    MDC.put("jobType", jobType);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("jobType");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("attempt");
    MDC.remove("current");
    MDC.remove("total");
    MDC.remove("retryAfterSeconds");
    MDC.remove("status");
    MDC.remove("durationMs");
    MDC.remove("exitCode");
  }
}
