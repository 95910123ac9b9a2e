package com.scholary.jobrunner.ratelimit;

import java.time.Duration;

/** Suspends the calling thread. Swappable so backoff waits can be observed in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
