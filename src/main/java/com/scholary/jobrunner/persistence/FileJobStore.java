package com.scholary.jobrunner.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scholary.jobrunner.job.Job;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the job map as one aggregate JSON file, {@code <dataDir>/jobs.json}.
 *
 * <p>Writes happen on a single background thread. The snapshot is taken on that thread, so when
 * several mutations queue up one write covers all of them and later queued writes become no-ops.
 * The file is written to a temp file first and then renamed over the old one, so readers never
 * see a half-written snapshot.
 *
 * <p>The directory is recreated on every write if it has gone missing. A corrupt or unreadable
 * file is logged and treated as empty.
 */
public class FileJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileJobStore.class);

  static final String JOBS_FILE = "jobs.json";
  private static final long FLUSH_TIMEOUT_SECONDS = 10;

  private final Path dataDir;
  private final Path jobsFile;
  private final ObjectMapper objectMapper;
  private final ExecutorService writer;
  private final AtomicReference<Supplier<List<Job>>> pendingSnapshot = new AtomicReference<>();

  public FileJobStore(Path dataDir, ObjectMapper objectMapper) {
    this.dataDir = dataDir;
    this.jobsFile = dataDir.resolve(JOBS_FILE);
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    this.writer =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "job-store-writer");
              thread.setDaemon(true);
              return thread;
            });

    LOGGER.info("Initialized job store: file={}", jobsFile.toAbsolutePath());
  }

  @Override
  public List<Job> load() {
    if (!Files.exists(jobsFile)) {
      LOGGER.debug("No job snapshot at {}", jobsFile);
      return List.of();
    }

    try {
      JobSnapshot snapshot = objectMapper.readValue(jobsFile.toFile(), JobSnapshot.class);
      List<Job> jobs = snapshot.jobs() == null ? List.of() : snapshot.jobs();
      LOGGER.info("Loaded {} jobs from {}", jobs.size(), jobsFile);
      return jobs;
    } catch (IOException e) {
      LOGGER.warn("Ignoring unreadable job snapshot {}: {}", jobsFile, e.getMessage());
      return List.of();
    }
  }

  @Override
  public void persist(Supplier<List<Job>> snapshot) {
    pendingSnapshot.set(snapshot);
    try {
      writer.execute(this::writePending);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Job store is closed, dropping snapshot request");
    }
  }

  @Override
  public void flush() {
    try {
      writer.submit(() -> {}).get(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Job store already closed, nothing to flush");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while flushing job store");
    } catch (ExecutionException | TimeoutException e) {
      LOGGER.warn("Job store flush did not finish: {}", e.toString());
    }
  }

  @Override
  public void close() {
    flush();
    writer.shutdown();
    try {
      if (!writer.awaitTermination(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Job store writer did not stop in time");
        writer.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      writer.shutdownNow();
    }
  }

  public Path getJobsFile() {
    return jobsFile;
  }

  private void writePending() {
    Supplier<List<Job>> source = pendingSnapshot.getAndSet(null);
    if (source == null) {
      // an earlier task already wrote the latest state
      return;
    }

    Path tempFile = dataDir.resolve(JOBS_FILE + ".tmp");
    try {
      List<Job> snapshot = source.get();
      Files.createDirectories(dataDir);
      objectMapper.writeValue(tempFile.toFile(), new JobSnapshot(snapshot));
      moveIntoPlace(tempFile);
      LOGGER.debug("Persisted {} jobs to {}", snapshot.size(), jobsFile);
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Failed to persist job snapshot to {}", jobsFile, e);
    }
  }

  private void moveIntoPlace(Path tempFile) throws IOException {
    try {
      Files.move(
          tempFile, jobsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tempFile, jobsFile, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** On-disk layout of {@code jobs.json}. */
  record JobSnapshot(List<Job> jobs) {}
}
