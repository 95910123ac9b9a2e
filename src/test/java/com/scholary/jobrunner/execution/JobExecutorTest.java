package com.scholary.jobrunner.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.jobrunner.config.JobRunnerProperties;
import com.scholary.jobrunner.job.Job;
import com.scholary.jobrunner.job.JobRegistry;
import com.scholary.jobrunner.job.JobStatus;
import com.scholary.jobrunner.job.JobType;
import com.scholary.jobrunner.progress.ProgressParser;
import com.scholary.jobrunner.ratelimit.RateLimitCoordinator;
import com.scholary.jobrunner.ratelimit.RateLimitSignalDetector;
import com.scholary.jobrunner.support.InMemoryJobStore;
import com.scholary.jobrunner.support.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs real {@code /bin/sh} processes in place of the job scripts. */
@DisabledOnOs(OS.WINDOWS)
class JobExecutorTest {

  @TempDir Path workDir;

  private MutableClock clock;
  private JobRegistry registry;
  private RateLimitCoordinator rateLimitCoordinator;
  private List<Duration> backoffWaits;
  private JobExecutor executor;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpoch();
    registry = new JobRegistry(new InMemoryJobStore(), clock);
    backoffWaits = new ArrayList<>();
    rateLimitCoordinator =
        new RateLimitCoordinator(
            clock,
            duration -> {
              backoffWaits.add(duration);
              clock.advance(duration);
            });
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.close();
    }
  }

  @Test
  void execute_shouldCompleteWithProgressOutputAndJsonData() {
    executor =
        executorFor(
            shell("echo 'Progress: 1/2'; echo 'Progress: 2/2'; echo '{\"pages\":2}'"),
            Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.startedAt()).isNotNull();
    assertThat(job.progress().current()).isEqualTo(2);
    assertThat(job.progress().total()).isEqualTo(2);
    assertThat(job.progress().message()).isEqualTo("Processing 2 of 2");
    assertThat(job.result().success()).isTrue();
    assertThat(job.result().output()).contains("Progress: 1/2");
    assertThat(job.result().data().get("pages").asInt()).isEqualTo(2);
    assertThat(executor.runningCount()).isZero();
  }

  @Test
  void execute_nonZeroExit_shouldFailWithStderr() {
    executor =
        executorFor(shell("echo 'Notion token invalid' >&2; exit 3"), Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().success()).isFalse();
    assertThat(job.result().error()).isEqualTo("Notion token invalid");
  }

  @Test
  void execute_nonZeroExitWithoutStderr_shouldReportExitCode() {
    executor = executorFor(shell("exit 4"), Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    assertThat(registry.getJob(id).orElseThrow().result().error())
        .isEqualTo("Process exited with code 4");
  }

  @Test
  void execute_unknownType_shouldFailWithoutSpawning() {
    executor = executorFor(shell("touch spawned"), Duration.ofSeconds(10));
    String id = registry.createJob("notion:unknown");

    executor.execute(id, "notion:unknown", null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().error()).startsWith("Unknown job type: notion:unknown");
    assertThat(workDir.resolve("spawned")).doesNotExist();
  }

  @Test
  void execute_spawnFailure_shouldFailWithoutRunning() {
    executor =
        executorFor(
            new JobCommand(
                List.of(workDir.resolve("missing-binary").toString()),
                ArgumentBuilder.NONE,
                Duration.ofSeconds(10)),
            Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().error()).startsWith("Failed to start process");
    assertThat(job.startedAt()).isEqualTo(job.completedAt());
  }

  @Test
  void execute_shouldPassOptionsAsArguments() {
    JobCommand echoArgs =
        new JobCommand(
            List.of("/bin/sh", "-c", "echo \"args: $*\"", "sh"),
            JobCommandTable::fetchAllArguments,
            Duration.ofSeconds(10));
    executor = executorFor(echoArgs, Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), new JobOptions(5, null, true, false, null));

    assertThat(registry.getJob(id).orElseThrow().result().output())
        .isEqualTo("args: --max-pages 5 --force\n");
  }

  @Test
  void execute_shouldOnlyPassWhitelistedEnvironment() {
    executor =
        new JobExecutor(
            registry,
            table(shell("echo \"key=${NOTION_API_KEY:-none} secret=${AWS_SECRET:-none}\"")),
            rateLimitCoordinator,
            new ProgressParser(),
            new RateLimitSignalDetector(),
            new JsonOutputExtractor(new ObjectMapper()),
            new ChildEnvironment(
                List.of("NOTION_API_KEY"), Map.of("NOTION_API_KEY", "abc", "AWS_SECRET", "leak")),
            properties(2));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    assertThat(registry.getJob(id).orElseThrow().result().output())
        .isEqualTo("key=abc secret=none\n");
  }

  @Test
  void execute_rateLimitedRun_shouldBackOffAndRetry() {
    String script =
        "if [ -f marker ]; then echo 'Progress: 1/1'; exit 0; fi; "
            + "touch marker; echo 'APIResponseError: status 429' >&2; exit 1";
    executor = executorFor(shell(script), Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(backoffWaits).containsExactly(Duration.ofMillis(1_000));
  }

  @Test
  void execute_rateLimitRetriesExhausted_shouldFail() throws IOException {
    executor =
        executorFor(
            shell("echo attempt >> attempts; echo 'Too Many Requests' >&2; exit 1"),
            Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().error()).isEqualTo("Too Many Requests");
    assertThat(Files.readAllLines(workDir.resolve("attempts"))).hasSize(3);
  }

  @Test
  void execute_retryHint_shouldSetBackoffWindow() {
    String script =
        "if [ -f marker ]; then exit 0; fi; "
            + "touch marker; echo 'rate limited, Retry-After: 3' >&2; exit 1";
    executor = executorFor(shell(script), Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());

    executor.execute(id, JobType.FETCH.id(), null);

    assertThat(registry.getJob(id).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(backoffWaits).containsExactly(Duration.ofSeconds(3));
  }

  @Test
  void execute_shouldKillProcessOnTimeout() {
    executor = executorFor(shell("exec sleep 30"), Duration.ofSeconds(1));
    String id = registry.createJob(JobType.FETCH.id());

    long start = System.nanoTime();
    executor.execute(id, JobType.FETCH.id(), null);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().error()).isEqualTo("Job execution timed out after 1 seconds");
    assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start)).isLessThan(15);
  }

  @Test
  void execute_timeout_shouldAlsoKillSpawnedWorkers() throws InterruptedException {
    executor =
        executorFor(
            shell("(sleep 3; touch survived) & echo 'worker up'; wait"), Duration.ofSeconds(1));
    String id = registry.createJob(JobType.FETCH.id());

    long start = System.nanoTime();
    executor.execute(id, JobType.FETCH.id(), null);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertThat(registry.getJob(id).orElseThrow().status()).isEqualTo(JobStatus.FAILED);
    assertThat(elapsedMs).isLessThan(JobExecutor.OUTPUT_DRAIN_TIMEOUT.toMillis());
    Thread.sleep(3_500);
    assertThat(workDir.resolve("survived")).doesNotExist();
  }

  @Test
  void terminate_shouldAlsoKillSpawnedWorkers() throws Exception {
    executor =
        executorFor(
            shell("(sleep 3; touch survived) & echo 'Progress: 1/1'; wait"),
            Duration.ofSeconds(60));
    String id = registry.createJob(JobType.FETCH.id());

    CompletableFuture<Void> run =
        CompletableFuture.runAsync(() -> executor.execute(id, JobType.FETCH.id(), null));
    awaitWorkerStarted(id);
    registry.cancel(id);
    assertThat(executor.terminate(id)).isTrue();
    run.get(JobExecutor.OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

    Thread.sleep(3_500);
    assertThat(workDir.resolve("survived")).doesNotExist();
  }

  @Test
  void terminate_shouldStopRunningProcessAndKeepCancellation() throws Exception {
    executor = executorFor(shell("echo started; exec sleep 30"), Duration.ofSeconds(60));
    String id = registry.createJob(JobType.FETCH.id());

    CompletableFuture<Void> run =
        CompletableFuture.runAsync(() -> executor.execute(id, JobType.FETCH.id(), null));
    awaitStatus(id, JobStatus.RUNNING);
    registry.cancel(id);
    assertThat(executor.terminate(id)).isTrue();
    run.get(15, TimeUnit.SECONDS);

    Job job = registry.getJob(id).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.result().error()).isEqualTo(JobRegistry.CANCELLED_ERROR);
    assertThat(executor.terminate(id)).isFalse();
  }

  @Test
  void execute_cancelledBeforeStart_shouldNotSpawn() {
    executor = executorFor(shell("touch spawned"), Duration.ofSeconds(10));
    String id = registry.createJob(JobType.FETCH.id());
    registry.cancel(id);

    executor.execute(id, JobType.FETCH.id(), null);

    assertThat(workDir.resolve("spawned")).doesNotExist();
    assertThat(registry.getJob(id).orElseThrow().result().error())
        .isEqualTo(JobRegistry.CANCELLED_ERROR);
  }

  private void awaitStatus(String id, JobStatus status) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (System.nanoTime() < deadline) {
      if (registry.getJob(id).map(Job::status).orElse(null) == status) {
        return;
      }
      Thread.sleep(20);
    }
    throw new AssertionError("Job " + id + " never reached " + status);
  }

  private void awaitWorkerStarted(String id) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (System.nanoTime() < deadline) {
      if (registry.getJob(id).map(Job::progress).filter(p -> p.current() == 1).isPresent()) {
        return;
      }
      Thread.sleep(20);
    }
    throw new AssertionError("Job " + id + " never reported progress");
  }

  private JobExecutor executorFor(JobCommand command, Duration timeout) {
    return new JobExecutor(
        registry,
        table(command.withTimeout(timeout)),
        rateLimitCoordinator,
        new ProgressParser(),
        new RateLimitSignalDetector(),
        new JsonOutputExtractor(new ObjectMapper()),
        new ChildEnvironment(List.of("PATH"), System.getenv()),
        properties(2));
  }

  private static JobCommandTable table(JobCommand command) {
    Map<JobType, JobCommand> commands = new EnumMap<>(JobType.class);
    commands.put(JobType.FETCH, command);
    return new JobCommandTable(commands, null);
  }

  private static JobCommand shell(String script) {
    return new JobCommand(
        List.of("/bin/sh", "-c", script), ArgumentBuilder.NONE, Duration.ofSeconds(10));
  }

  private JobRunnerProperties properties(int maxRateLimitRetries) {
    return new JobRunnerProperties(
        "bun",
        workDir.toString(),
        workDir.resolve("data").toString(),
        null,
        Duration.ofMillis(500),
        maxRateLimitRetries,
        1,
        1,
        List.of("PATH"));
  }
}
