package com.scholary.jobrunner.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.jobrunner.config.JobRunnerProperties;
import com.scholary.jobrunner.job.Job;
import com.scholary.jobrunner.job.JobRegistry;
import com.scholary.jobrunner.job.JobResult;
import com.scholary.jobrunner.job.JobStatus;
import com.scholary.jobrunner.job.JobType;
import com.scholary.jobrunner.logging.JobEventLogger;
import com.scholary.jobrunner.progress.ProgressParser;
import com.scholary.jobrunner.ratelimit.RateLimitCoordinator;
import com.scholary.jobrunner.ratelimit.RateLimitSignal;
import com.scholary.jobrunner.ratelimit.RateLimitSignalDetector;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one job as a child process and drives its record through the registry.
 *
 * <p>Per job:
 *
 * <ol>
 *   <li>Resolve the command for the job type. Unknown types fail the job without spawning.
 *   <li>Wait out any active rate-limit backoff, then spawn the process with a whitelisted
 *       environment. The job moves to {@code running} only once the process has started.
 *   <li>Read stdout and stderr line by line. Lines matching a progress pattern update the job's
 *       progress; lines reporting a rate limit are recorded with the coordinator.
 *   <li>On exit 0 the job completes with stdout and any trailing JSON object as its result. A
 *       non-zero exit after a rate-limit report is retried after the backoff, up to the configured
 *       number of retries. Anything else, including a timeout, fails the job.
 * </ol>
 *
 * <p>Stopping a job, on timeout, cancellation or shutdown, signals the whole process tree so that
 * workers spawned by the script die with it.
 *
 * <p>{@link #execute} never throws for process or job failures; they end up in the job record.
 */
public class JobExecutor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobExecutor.class);
  private static final JobEventLogger EVENTS = new JobEventLogger(LOGGER);

  static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final JobRegistry registry;
  private final JobCommandTable commandTable;
  private final RateLimitCoordinator rateLimitCoordinator;
  private final ProgressParser progressParser;
  private final RateLimitSignalDetector rateLimitDetector;
  private final JsonOutputExtractor jsonOutputExtractor;
  private final ChildEnvironment childEnvironment;
  private final Path workingDir;
  private final Duration killGracePeriod;
  private final int maxRateLimitRetries;

  private final Map<String, Process> runningProcesses = new ConcurrentHashMap<>();
  private final ExecutorService outputReaders;

  public JobExecutor(
      JobRegistry registry,
      JobCommandTable commandTable,
      RateLimitCoordinator rateLimitCoordinator,
      ProgressParser progressParser,
      RateLimitSignalDetector rateLimitDetector,
      JsonOutputExtractor jsonOutputExtractor,
      ChildEnvironment childEnvironment,
      JobRunnerProperties properties) {
    this.registry = registry;
    this.commandTable = commandTable;
    this.rateLimitCoordinator = rateLimitCoordinator;
    this.progressParser = progressParser;
    this.rateLimitDetector = rateLimitDetector;
    this.jsonOutputExtractor = jsonOutputExtractor;
    this.childEnvironment = childEnvironment;
    this.workingDir = Path.of(properties.workingDir());
    this.killGracePeriod = properties.killGracePeriod();
    this.maxRateLimitRetries = properties.maxRateLimitRetries();
    this.outputReaders = Executors.newCachedThreadPool(daemonThreads("job-output-"));
  }

  /**
   * Run job {@code jobId} to completion on the calling thread.
   *
   * @param type job type id; an unknown id fails the job
   * @param options job options, may be null
   */
  public void execute(String jobId, String type, JobOptions options) {
    Optional<JobType> jobType = JobType.find(type);
    if (jobType.isEmpty()) {
      String error =
          String.format("Unknown job type: %s. Available types: %s", type, JobType.availableIds());
      LOGGER.error("Cannot execute job {}: {}", jobId, error);
      registry.updateStatus(jobId, JobStatus.FAILED, JobResult.failure(error));
      return;
    }

    JobCommand command = commandTable.commandFor(jobType.get());
    List<String> commandLine = command.commandLine(options);

    JobEventLogger.setJobContext(jobId, type);
    long startNanos = System.nanoTime();
    try {
      run(jobId, commandLine, command.timeout(), startNanos);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Job {} interrupted", jobId);
      fail(jobId, "Job execution interrupted", null, null, startNanos);
    } finally {
      runningProcesses.remove(jobId);
      JobEventLogger.clearJobContext();
    }
  }

  /**
   * Ask the process of a running job to stop. Escalates to a forced kill if the process is still
   * alive after the grace period.
   *
   * @return true if a process was running for the job
   */
  public boolean terminate(String jobId) {
    Process process = runningProcesses.get(jobId);
    if (process == null) {
      return false;
    }
    LOGGER.info("Terminating process for job {}", jobId);
    stop(process);
    return true;
  }

  /** Stop every running job process and release the output reader threads. */
  @Override
  public void close() {
    runningProcesses.forEach(
        (jobId, process) -> {
          LOGGER.warn("Shutting down, terminating process for job {}", jobId);
          processTree(process).forEach(ProcessHandle::destroyForcibly);
        });
    outputReaders.shutdownNow();
  }

  int runningCount() {
    return runningProcesses.size();
  }

  private void run(String jobId, List<String> commandLine, Duration timeout, long startNanos)
      throws InterruptedException {
    for (int attempt = 1; ; attempt++) {
      rateLimitCoordinator.waitForBackoff();
      if (isFinished(jobId)) {
        LOGGER.info("Job {} already finished, not starting a process", jobId);
        return;
      }

      Process process;
      try {
        process = start(commandLine);
      } catch (IOException e) {
        LOGGER.error("Failed to start process for job {}: {}", jobId, e.getMessage());
        fail(jobId, "Failed to start process: " + e.getMessage(), null, null, startNanos);
        return;
      }

      runningProcesses.put(jobId, process);
      if (isFinished(jobId)) {
        // cancelled while the process was starting
        stop(process);
      } else {
        registry.updateStatus(jobId, JobStatus.RUNNING);
        EVENTS.logJobStarted(jobId, commandLine, attempt);
      }

      ProcessOutcome outcome = supervise(jobId, process, timeout);
      runningProcesses.remove(jobId, process);

      if (outcome.succeeded()) {
        complete(jobId, outcome, startNanos);
        return;
      }
      if (outcome.rateLimited()
          && !outcome.timedOut()
          && attempt <= maxRateLimitRetries
          && !isFinished(jobId)) {
        LOGGER.warn(
            "Job {} exited with code {} after a rate limit, retrying ({}/{})",
            jobId,
            outcome.exitCode(),
            attempt,
            maxRateLimitRetries);
        continue;
      }
      fail(
          jobId,
          outcome.failureMessage(timeout),
          outcome.stdout(),
          outcome.exitCode(),
          startNanos);
      return;
    }
  }

  private Process start(List<String> commandLine) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(commandLine).directory(workingDir.toFile());
    childEnvironment.applyTo(pb.environment());
    return pb.start();
  }

  private ProcessOutcome supervise(String jobId, Process process, Duration timeout)
      throws InterruptedException {
    OutputCapture stdout = new OutputCapture();
    OutputCapture stderr = new OutputCapture();
    AtomicReference<RateLimitSignal> rateLimit = new AtomicReference<>();
    Map<String, String> mdc = MDC.getCopyOfContextMap();

    Future<?> stdoutReader =
        outputReaders.submit(
            () ->
                readLines(
                    process.getInputStream(),
                    mdc,
                    line -> {
                      stdout.append(line);
                      LOGGER.debug("[stdout] {}", line);
                      progressParser
                          .parse(line)
                          .ifPresent(
                              p -> {
                                registry.updateProgress(jobId, p.current(), p.total(), p.message());
                                EVENTS.logJobProgress(jobId, p.current(), p.total());
                              });
                      detectRateLimit(jobId, line, rateLimit);
                    }));
    Future<?> stderrReader =
        outputReaders.submit(
            () ->
                readLines(
                    process.getErrorStream(),
                    mdc,
                    line -> {
                      stderr.append(line);
                      LOGGER.warn("[stderr] {}", line);
                      detectRateLimit(jobId, line, rateLimit);
                    }));

    boolean timedOut = false;
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        timedOut = true;
        LOGGER.warn("Job {} timed out after {}s, terminating", jobId, timeout.toSeconds());
        List<ProcessHandle> tree = processTree(process);
        tree.forEach(ProcessHandle::destroy);
        if (!awaitExit(tree, killGracePeriod)) {
          LOGGER.warn("Job {} still alive after SIGTERM, killing", jobId);
          killSurvivors(tree);
          awaitExit(tree, killGracePeriod);
        }
      }
    } catch (InterruptedException e) {
      processTree(process).forEach(ProcessHandle::destroyForcibly);
      throw e;
    }

    drain(process, stdoutReader);
    drain(process, stderrReader);

    Integer exitCode = process.isAlive() ? null : process.exitValue();
    return new ProcessOutcome(
        exitCode, timedOut, stdout.toString(), stderr.toString(), rateLimit.get() != null);
  }

  private void detectRateLimit(
      String jobId, String line, AtomicReference<RateLimitSignal> rateLimit) {
    rateLimitDetector
        .detect(line)
        .ifPresent(
            signal -> {
              // one backoff step per attempt, however many lines mention the limit
              if (rateLimit.compareAndSet(null, signal)) {
                EVENTS.logRateLimitSignal(jobId, signal.retryAfterSeconds());
                rateLimitCoordinator.recordHit(signal.retryAfterSeconds());
              }
            });
  }

  private void readLines(InputStream stream, Map<String, String> mdc, Consumer<String> onLine) {
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        onLine.accept(line);
      }
    } catch (IOException e) {
      LOGGER.debug("Output stream closed: {}", e.getMessage());
    } finally {
      MDC.clear();
    }
  }

  private void drain(Process process, Future<?> reader) throws InterruptedException {
    try {
      reader.get(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      // a grandchild may still hold the pipe open
      LOGGER.warn("Output of finished process not drained, closing streams");
      closeQuietly(process.getInputStream());
      closeQuietly(process.getErrorStream());
      reader.cancel(true);
    } catch (ExecutionException e) {
      LOGGER.error("Output reader failed", e.getCause());
    }
  }

  private static void closeQuietly(InputStream stream) {
    try {
      stream.close();
    } catch (IOException e) {
      LOGGER.debug("Failed to close process stream: {}", e.getMessage());
    }
  }

  private void stop(Process process) {
    List<ProcessHandle> tree = processTree(process);
    tree.forEach(ProcessHandle::destroy);
    allExited(tree)
        .orTimeout(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              LOGGER.warn("Process {} ignored SIGTERM, killing its tree", process.pid());
              killSurvivors(tree);
              return null;
            });
  }

  /**
   * Descendants first, then the process itself. Taken before any signal is sent, since children
   * of a dead process are re-parented and no longer show up as its descendants.
   */
  private static List<ProcessHandle> processTree(Process process) {
    List<ProcessHandle> tree = new ArrayList<>(process.descendants().toList());
    tree.add(process.toHandle());
    return tree;
  }

  private static CompletableFuture<Void> allExited(List<ProcessHandle> tree) {
    return CompletableFuture.allOf(
        tree.stream().map(ProcessHandle::onExit).toArray(CompletableFuture[]::new));
  }

  private static boolean awaitExit(List<ProcessHandle> tree, Duration timeout)
      throws InterruptedException {
    try {
      allExited(tree).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      LOGGER.debug("Waiting for process exit failed: {}", e.getMessage());
      return false;
    }
  }

  private static void killSurvivors(List<ProcessHandle> tree) {
    tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
  }

  private boolean isFinished(String jobId) {
    return registry.getJob(jobId).map(Job::isTerminal).orElse(true);
  }

  private void complete(String jobId, ProcessOutcome outcome, long startNanos) {
    if (isFinished(jobId)) {
      LOGGER.info("Job {} finished elsewhere, dropping its successful exit", jobId);
      return;
    }
    JsonNode data = jsonOutputExtractor.extract(outcome.stdout());
    registry.updateStatus(jobId, JobStatus.COMPLETED, JobResult.succeeded(outcome.stdout(), data));
    EVENTS.logJobFinished(
        jobId, JobStatus.COMPLETED.wireName(), outcome.exitCode(), elapsedMs(startNanos));
  }

  private void fail(String jobId, String error, String output, Integer exitCode, long startNanos) {
    if (isFinished(jobId)) {
      LOGGER.info("Job {} finished elsewhere, dropping failure: {}", jobId, error);
      return;
    }
    registry.updateStatus(jobId, JobStatus.FAILED, new JobResult(false, output, error, null));
    EVENTS.logJobFinished(jobId, JobStatus.FAILED.wireName(), exitCode, elapsedMs(startNanos));
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Output collected from one stream, safe to read while the reader thread is still going. */
  private static final class OutputCapture {
    private final StringBuilder buffer = new StringBuilder();

    synchronized void append(String line) {
      buffer.append(line).append('\n');
    }

    @Override
    public synchronized String toString() {
      return buffer.toString();
    }
  }

  private record ProcessOutcome(
      Integer exitCode, boolean timedOut, String stdout, String stderr, boolean rateLimited) {

    boolean succeeded() {
      return !timedOut && exitCode != null && exitCode == 0;
    }

    String failureMessage(Duration timeout) {
      if (timedOut) {
        return "Job execution timed out after " + timeout.toSeconds() + " seconds";
      }
      if (!stderr.isBlank()) {
        return stderr.trim();
      }
      return "Process exited with code " + exitCode;
    }
  }
}
