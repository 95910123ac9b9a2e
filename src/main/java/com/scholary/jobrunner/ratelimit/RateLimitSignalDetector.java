package com.scholary.jobrunner.ratelimit;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises rate-limit reports in child process output, e.g. {@code HTTP 429}, {@code Too Many
 * Requests} or {@code rate limited}, along with an optional {@code Retry-After: 30} or {@code retry
 * after 30 seconds} hint.
 *
 * <p>A bare mention of a rate limit, such as {@code rate limit: 3 req/s}, is not a report.
 */
public final class RateLimitSignalDetector {

  private static final Pattern RATE_LIMIT_PATTERN =
      Pattern.compile(
          "(?:status|code|http|error)[^0-9\\n]{0,10}429\\b|too many requests"
              + "|rate[ _-]?limit(?:ed|[ _-]?(?:hit|exceeded|reached|error))",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern RETRY_AFTER_PATTERN =
      Pattern.compile(
          "retry[ _-]?after[\"']?\\s*[:=]?\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

  /**
   * Inspect one line of output.
   *
   * @return a signal if the line reports a rate limit
   */
  public Optional<RateLimitSignal> detect(String line) {
    if (line == null || line.isEmpty() || !RATE_LIMIT_PATTERN.matcher(line).find()) {
      return Optional.empty();
    }

    Matcher retryAfter = RETRY_AFTER_PATTERN.matcher(line);
    if (retryAfter.find()) {
      return Optional.of(new RateLimitSignal(Double.parseDouble(retryAfter.group(1))));
    }
    return Optional.of(RateLimitSignal.withoutHint());
  }
}
