package com.scholary.jobrunner.execution;

import java.util.List;

/**
 * Turns job options into extra command-line arguments. Implementations must be deterministic and
 * emit nothing for absent or falsy options.
 */
@FunctionalInterface
public interface ArgumentBuilder {

  ArgumentBuilder NONE = options -> List.of();

  List<String> build(JobOptions options);
}
