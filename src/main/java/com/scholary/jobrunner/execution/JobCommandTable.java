package com.scholary.jobrunner.execution;

import com.scholary.jobrunner.config.JobRunnerProperties;
import com.scholary.jobrunner.job.JobType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each {@link JobType} to the command that runs it.
 *
 * <p>A configured timeout override replaces every per-type timeout, capped at {@link
 * #MAX_TIMEOUT}.
 */
public class JobCommandTable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobCommandTable.class);

  public static final Duration MAX_TIMEOUT = Duration.ofHours(2);
  static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
  static final Duration FETCH_ALL_TIMEOUT = Duration.ofMinutes(60);
  static final Duration TRANSLATE_TIMEOUT = Duration.ofMinutes(30);

  private final Map<JobType, JobCommand> commands;

  public JobCommandTable(JobRunnerProperties properties) {
    this(defaultCommands(properties.runtime()), properties.timeoutOverride());
  }

  public JobCommandTable(Map<JobType, JobCommand> commands, Duration timeoutOverride) {
    Map<JobType, JobCommand> resolved = new EnumMap<>(JobType.class);
    Duration override = clamp(timeoutOverride);
    commands.forEach(
        (type, command) ->
            resolved.put(type, override == null ? command : command.withTimeout(override)));
    this.commands = Map.copyOf(resolved);
    if (override != null) {
      LOGGER.info("Job timeout override active: {}s for every job type", override.toSeconds());
    }
  }

  /**
   * @throws IllegalStateException if no command is registered for {@code type}
   */
  public JobCommand commandFor(JobType type) {
    JobCommand command = commands.get(type);
    if (command == null) {
      throw new IllegalStateException("No command configured for job type " + type.id());
    }
    return command;
  }

  static Map<JobType, JobCommand> defaultCommands(String runtime) {
    Map<JobType, JobCommand> commands = new EnumMap<>(JobType.class);
    for (JobType type : JobType.values()) {
      commands.put(type, commandFor(type, runtime));
    }
    return commands;
  }

  private static JobCommand commandFor(JobType type, String runtime) {
    return switch (type) {
      case FETCH -> script(runtime, "scripts/notion-fetch/index.ts", DEFAULT_TIMEOUT);
      case FETCH_ALL ->
          script(
              runtime,
              List.of("scripts/notion-fetch-all"),
              JobCommandTable::fetchAllArguments,
              FETCH_ALL_TIMEOUT);
      case COUNT_PAGES ->
          script(
              runtime,
              List.of("scripts/notion-count-pages/index.ts"),
              JobCommandTable::countPagesArguments,
              DEFAULT_TIMEOUT);
      case TRANSLATE -> script(runtime, "scripts/notion-translate", TRANSLATE_TIMEOUT);
      case STATUS_TRANSLATION -> statusWorkflow(runtime, "translation");
      case STATUS_DRAFT -> statusWorkflow(runtime, "draft");
      case STATUS_PUBLISH -> statusWorkflow(runtime, "publish");
      case STATUS_PUBLISH_PRODUCTION -> statusWorkflow(runtime, "publish-production");
    };
  }

  private static JobCommand statusWorkflow(String runtime, String workflow) {
    return script(
        runtime,
        List.of("scripts/notion-status", "--workflow", workflow),
        ArgumentBuilder.NONE,
        DEFAULT_TIMEOUT);
  }

  private static JobCommand script(String runtime, String script, Duration timeout) {
    return script(runtime, List.of(script), ArgumentBuilder.NONE, timeout);
  }

  private static JobCommand script(
      String runtime, List<String> scriptArgs, ArgumentBuilder arguments, Duration timeout) {
    List<String> base = new ArrayList<>();
    base.add(runtime);
    base.addAll(scriptArgs);
    return new JobCommand(base, arguments, timeout);
  }

  static List<String> fetchAllArguments(JobOptions options) {
    List<String> args = new ArrayList<>();
    addValue(args, "--max-pages", options.maxPages());
    addValue(args, "--status-filter", options.statusFilter());
    addFlag(args, "--force", options.force());
    addFlag(args, "--dry-run", options.dryRun());
    addFlag(args, "--include-removed", options.includeRemoved());
    return args;
  }

  static List<String> countPagesArguments(JobOptions options) {
    List<String> args = new ArrayList<>();
    addFlag(args, "--include-removed", options.includeRemoved());
    addValue(args, "--status-filter", options.statusFilter());
    return args;
  }

  private static void addValue(List<String> args, String flag, Integer value) {
    if (value != null && value != 0) {
      args.add(flag);
      args.add(String.valueOf(value));
    }
  }

  private static void addValue(List<String> args, String flag, String value) {
    if (value != null && !value.isEmpty()) {
      args.add(flag);
      args.add(value);
    }
  }

  private static void addFlag(List<String> args, String flag, Boolean value) {
    if (Boolean.TRUE.equals(value)) {
      args.add(flag);
    }
  }

  private static Duration clamp(Duration override) {
    if (override == null || override.isZero() || override.isNegative()) {
      return null;
    }
    if (override.compareTo(MAX_TIMEOUT) > 0) {
      LOGGER.warn(
          "Job timeout override {}s exceeds maximum, using {}s",
          override.toSeconds(),
          MAX_TIMEOUT.toSeconds());
      return MAX_TIMEOUT;
    }
    return override;
  }
}
