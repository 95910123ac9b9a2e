package com.scholary.jobrunner.job;

import com.scholary.jobrunner.persistence.JobStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative registry of jobs and their lifecycle.
 *
 * <p>Jobs are immutable snapshots; each mutation swaps in a new record through {@link
 * ConcurrentHashMap#computeIfPresent}, so updates to different jobs never contend and concurrent
 * updates to the same job are last-write-wins without corrupting the map. Reads never block.
 *
 * <p>After every successful mutation the full map is handed to the {@link JobStore}. Storage
 * problems never surface here.
 *
 * <p>Status rules:
 *
 * <ul>
 *   <li>Unknown ids are a silent no-op for every mutation.
 *   <li>{@code startedAt} is set once, on the first move out of {@code pending}.
 *   <li>{@code completedAt} and {@code result} are set on entering a terminal status. Re-entering
 *       the same terminal status may replace the result but keeps the timestamps.
 *   <li>Moves out of a terminal status are rejected and logged.
 *   <li>A cancelled job keeps its cancellation result even if its process reports in later.
 * </ul>
 *
 * <p>On construction the registry reloads the last snapshot. Jobs that were still pending or
 * running when the previous process stopped are marked failed; they are never re-run.
 */
public class JobRegistry implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  public static final String CANCELLED_ERROR = "Job cancelled by user";
  public static final String LOST_ON_RESTART_ERROR = "Job lost after server restart";
  static final String DEFAULT_FAILURE_ERROR = "Job failed";

  private final ConcurrentHashMap<String, Entry> jobs = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final JobStore store;
  private final Clock clock;

  public JobRegistry(JobStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
    rehydrate();
  }

  /**
   * Create a pending job. Does not validate {@code type} against {@link JobType}; that is the
   * caller's decision, so ad hoc types can be tracked too.
   *
   * @return the new job id
   */
  public String createJob(String type) {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Job type must not be blank");
    }

    String id = UUID.randomUUID().toString();
    jobs.put(id, new Entry(sequence.incrementAndGet(), Job.pending(id, type, clock.instant())));
    LOGGER.debug("Created job: id={}, type={}", id, type);
    persist();
    return id;
  }

  public Optional<Job> getJob(String id) {
    if (id == null) {
      return Optional.empty();
    }
    Entry entry = jobs.get(id);
    return entry == null ? Optional.empty() : Optional.of(entry.job());
  }

  public boolean updateStatus(String id, JobStatus status) {
    return updateStatus(id, status, null);
  }

  /**
   * Move a job to {@code status}.
   *
   * @param result stored when {@code status} is terminal; a default result is stored if null and
   *     the job has none yet. Its {@code success} flag is aligned with {@code status}.
   * @return true if the update was applied, false if the id is unknown or the move was rejected
   */
  public boolean updateStatus(String id, JobStatus status, JobResult result) {
    Objects.requireNonNull(status, "status");
    if (id == null) {
      return false;
    }

    AtomicBoolean applied = new AtomicBoolean(false);
    Entry updated =
        jobs.computeIfPresent(
            id,
            (key, entry) -> {
              Job job = entry.job();
              if (!job.status().canTransitionTo(status)) {
                LOGGER.warn(
                    "Rejected status transition for job {}: {} -> {}",
                    id,
                    job.status().wireName(),
                    status.wireName());
                return entry;
              }
              if (status.isTerminal() && isCancelled(job)) {
                LOGGER.debug(
                    "Job {} was cancelled, ignoring late {} update", id, status.wireName());
                return entry;
              }

              applied.set(true);
              return entry.with(applyStatus(job, status, result));
            });

    if (updated == null) {
      LOGGER.debug("Ignoring status update for unknown job {}", id);
      return false;
    }
    if (applied.get()) {
      persist();
    }
    return applied.get();
  }

  /**
   * Replace a job's progress. Unknown ids are ignored.
   *
   * @return true if a job was updated
   */
  public boolean updateProgress(String id, long current, long total, String message) {
    if (id == null) {
      return false;
    }
    JobProgress progress = new JobProgress(current, total, message);
    Entry updated =
        jobs.computeIfPresent(id, (key, entry) -> entry.with(entry.job().withProgress(progress)));
    if (updated == null) {
      LOGGER.debug("Ignoring progress update for unknown job {}", id);
      return false;
    }
    persist();
    return true;
  }

  /**
   * Cancel a pending or running job by failing it with a cancellation result. Stopping the
   * underlying process is up to the caller.
   *
   * @return the cancelled job, or empty if the id is unknown
   * @throws InvalidStateTransitionException if the job is already completed or failed
   */
  public Optional<Job> cancel(String id) {
    if (id == null) {
      return Optional.empty();
    }

    AtomicReference<JobStatus> conflict = new AtomicReference<>();
    Entry updated =
        jobs.computeIfPresent(
            id,
            (key, entry) -> {
              Job job = entry.job();
              if (job.isTerminal()) {
                conflict.set(job.status());
                return entry;
              }
              Instant now = clock.instant();
              Instant startedAt = job.startedAt() != null ? job.startedAt() : now;
              return entry.with(
                  job.withStatus(
                      JobStatus.FAILED, startedAt, now, JobResult.failure(CANCELLED_ERROR)));
            });

    if (updated == null) {
      return Optional.empty();
    }
    if (conflict.get() != null) {
      throw new InvalidStateTransitionException(
          id,
          conflict.get(),
          String.format(
              "Cannot cancel job with status: %s. Only pending or running jobs can be cancelled.",
              conflict.get().wireName()));
    }

    persist();
    return Optional.of(updated.job());
  }

  /** All jobs in creation order. */
  public List<Job> getAllJobs() {
    return jobs.values().stream()
        .sorted(Comparator.comparingLong(Entry::sequence))
        .map(Entry::job)
        .toList();
  }

  public List<Job> getJobsByStatus(JobStatus status) {
    return getAllJobs().stream().filter(job -> job.status() == status).toList();
  }

  public List<Job> getJobsByType(String type) {
    return getAllJobs().stream().filter(job -> job.type().equals(type)).toList();
  }

  /**
   * Remove a job from memory and from the persisted snapshot.
   *
   * @return true if a job was removed
   */
  public boolean deleteJob(String id) {
    if (id == null || jobs.remove(id) == null) {
      return false;
    }
    LOGGER.debug("Deleted job {}", id);
    persist();
    return true;
  }

  public int size() {
    return jobs.size();
  }

  /**
   * Flush pending writes, release the store and clear the in-memory map. The persisted snapshot is
   * left as it was.
   */
  @Override
  public void close() {
    store.close();
    jobs.clear();
  }

  private Job applyStatus(Job job, JobStatus status, JobResult result) {
    Instant now = clock.instant();
    Instant startedAt = job.startedAt();
    Instant completedAt = job.completedAt();
    JobResult newResult = job.result();

    if (status == JobStatus.RUNNING && startedAt == null) {
      startedAt = now;
    }
    if (status.isTerminal()) {
      if (completedAt == null) {
        completedAt = now;
      }
      if (startedAt == null) {
        // pending -> failed without ever starting a process
        startedAt = completedAt;
      }
      if (result != null) {
        newResult = alignSuccess(result, status);
      } else if (newResult == null) {
        newResult =
            status == JobStatus.COMPLETED
                ? JobResult.succeeded()
                : JobResult.failure(DEFAULT_FAILURE_ERROR);
      }
    }

    return job.withStatus(status, startedAt, completedAt, newResult);
  }

  private static JobResult alignSuccess(JobResult result, JobStatus status) {
    boolean success = status == JobStatus.COMPLETED;
    if (result.success() == success) {
      return result;
    }
    return new JobResult(success, result.output(), result.error(), result.data());
  }

  private static boolean isCancelled(Job job) {
    return job.status() == JobStatus.FAILED
        && job.result() != null
        && CANCELLED_ERROR.equals(job.result().error());
  }

  private void persist() {
    store.persist(this::getAllJobs);
  }

  private void rehydrate() {
    List<Job> persisted = store.load();
    boolean recovered = false;

    for (Job job : persisted) {
      if (job == null
          || job.id() == null
          || job.type() == null
          || job.status() == null
          || job.createdAt() == null) {
        LOGGER.warn("Skipping incomplete persisted job record: {}", job);
        continue;
      }

      Job restored = job;
      if (!job.isTerminal()) {
        Instant now = clock.instant();
        Instant startedAt = job.startedAt() != null ? job.startedAt() : now;
        restored =
            job.withStatus(
                JobStatus.FAILED, startedAt, now, JobResult.failure(LOST_ON_RESTART_ERROR));
        recovered = true;
        LOGGER.warn(
            "Job {} was {} when the previous server stopped, marking it failed",
            job.id(),
            job.status().wireName());
      }
      jobs.put(restored.id(), new Entry(sequence.incrementAndGet(), restored));
    }

    if (!persisted.isEmpty()) {
      LOGGER.info("Restored {} jobs from snapshot", jobs.size());
    }
    if (recovered) {
      persist();
    }
  }

  private record Entry(long sequence, Job job) {
    Entry with(Job updated) {
      return new Entry(sequence, updated);
    }
  }
}
