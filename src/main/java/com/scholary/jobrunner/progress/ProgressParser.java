package com.scholary.jobrunner.progress;

import com.scholary.jobrunner.job.JobProgress;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Extracts a progress tuple from a piece of child process output.
 *
 * <p>Patterns are tried in declaration order and the first match wins. The parser keeps no state
 * between calls; callers that read raw chunks must buffer up to line boundaries themselves.
 *
 * <p>Recognised formats (protocol version 1):
 *
 * <ul>
 *   <li>{@code Progress: 5/10}
 *   <li>{@code Processing 5 of 10}
 *   <li>{@code 5/10 pages}
 * </ul>
 */
public final class ProgressParser {

  public static final List<ProgressPattern> V1_PATTERNS =
      List.of(
          ProgressPattern.of("progress-ratio", "Progress:\\s*(\\d+)/(\\d+)"),
          ProgressPattern.of("processing-of", "Processing\\s+(\\d+)\\s+of\\s+(\\d+)"),
          ProgressPattern.of("pages-ratio", "(\\d+)/(\\d+)\\s+pages?"));

  private final List<ProgressPattern> patterns;

  public ProgressParser() {
    this(V1_PATTERNS);
  }

  public ProgressParser(List<ProgressPattern> patterns) {
    if (patterns.isEmpty()) {
      throw new IllegalArgumentException("At least one progress pattern is required");
    }
    this.patterns = List.copyOf(patterns);
  }

  /**
   * Parse a chunk of output.
   *
   * @return the progress described by the first matching pattern, or empty if none matches
   */
  public Optional<JobProgress> parse(String chunk) {
    if (chunk == null || chunk.isEmpty()) {
      return Optional.empty();
    }

    for (ProgressPattern candidate : patterns) {
      Matcher matcher = candidate.pattern().matcher(chunk);
      if (matcher.find()) {
        try {
          long current = Long.parseLong(matcher.group(1));
          long total = Long.parseLong(matcher.group(2));
          return Optional.of(new JobProgress(current, total, formatMessage(current, total)));
        } catch (NumberFormatException e) {
          // digits overflowing a long are not a usable progress signal
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

  static String formatMessage(long current, long total) {
    return String.format(Locale.ROOT, "Processing %d of %d", current, total);
  }
}
