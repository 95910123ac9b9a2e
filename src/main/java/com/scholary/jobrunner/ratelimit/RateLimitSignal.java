package com.scholary.jobrunner.ratelimit;

/**
 * A rate-limit indication seen in process output.
 *
 * @param retryAfterSeconds server-supplied retry hint, or {@code NaN} when none was given
 */
public record RateLimitSignal(double retryAfterSeconds) {

  public static RateLimitSignal withoutHint() {
    return new RateLimitSignal(Double.NaN);
  }

  public boolean hasRetryHint() {
    return Double.isFinite(retryAfterSeconds) && retryAfterSeconds > 0;
  }
}
