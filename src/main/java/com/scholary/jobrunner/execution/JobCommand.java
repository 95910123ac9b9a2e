package com.scholary.jobrunner.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How to launch one job type: a fixed command prefix, an optional argument builder for job
 * options, and the maximum wall-clock time the process may run.
 */
public record JobCommand(
    List<String> baseCommand, ArgumentBuilder argumentBuilder, Duration timeout) {

  public JobCommand {
    Objects.requireNonNull(timeout, "timeout");
    if (baseCommand == null || baseCommand.isEmpty()) {
      throw new IllegalArgumentException("Job command must have an executable");
    }
    baseCommand = List.copyOf(baseCommand);
    argumentBuilder = argumentBuilder == null ? ArgumentBuilder.NONE : argumentBuilder;
  }

  public JobCommand withTimeout(Duration newTimeout) {
    return new JobCommand(baseCommand, argumentBuilder, newTimeout);
  }

  /** Full command line for {@code options}; null options behave like no options. */
  public List<String> commandLine(JobOptions options) {
    List<String> commandLine = new ArrayList<>(baseCommand);
    commandLine.addAll(argumentBuilder.build(JobOptions.orNone(options)));
    return commandLine;
  }
}
