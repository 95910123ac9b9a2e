package com.scholary.jobrunner.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared backoff window for the rate-limited external API.
 *
 * <p>Every executor consults the same instance before spawning work that talks to the API. The
 * coordinator does not serialize callers; it only tells each one how long to wait, so several
 * callers may wake up together when a window closes.
 *
 * <p>Backoff policy:
 *
 * <ul>
 *   <li>A server-supplied retry hint sets the window to exactly that many seconds.
 *   <li>Otherwise a hit during an active window doubles it, capped at {@value #MAX_BACKOFF_MS} ms.
 *   <li>A hit with no active window (never hit, or the last window fully elapsed) starts again at
 *       {@value #INITIAL_BACKOFF_MS} ms.
 * </ul>
 *
 * <p>State lives in a single immutable {@link BackoffWindow} swapped atomically, so there is no
 * lock. State is not persisted and resets with the process.
 */
public class RateLimitCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitCoordinator.class);

  public static final long INITIAL_BACKOFF_MS = 1_000;
  public static final long MAX_BACKOFF_MS = 60_000;

  private final AtomicReference<BackoffWindow> window = new AtomicReference<>(BackoffWindow.NONE);
  private final Clock clock;
  private final Sleeper sleeper;

  public RateLimitCoordinator(Clock clock) {
    this(clock, Sleeper.system());
  }

  public RateLimitCoordinator(Clock clock, Sleeper sleeper) {
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /** True while a backoff window is active. Clears an expired window as a side effect. */
  public boolean isRateLimited() {
    return getRemainingBackoffMs() > 0;
  }

  /** Milliseconds left in the current window, or 0 when not limited. Never negative. */
  public long getRemainingBackoffMs() {
    long now = clock.millis();
    BackoffWindow current = window.get();
    long remaining = current.remainingAt(now);
    if (remaining == 0 && current != BackoffWindow.NONE) {
      window.compareAndSet(current, BackoffWindow.NONE);
    }
    return remaining;
  }

  /** Length of the current window in milliseconds, 0 if none has been recorded. */
  public long getCurrentBackoffMs() {
    return window.get().backoffMs();
  }

  /** Record a rate-limit hit without a server hint. */
  public void recordHit() {
    recordHit(Double.NaN);
  }

  /**
   * Record a rate-limit hit.
   *
   * @param retryAfterSeconds server hint; used as-is when positive and finite, ignored otherwise
   */
  public void recordHit(double retryAfterSeconds) {
    long now = clock.millis();
    boolean hinted = Double.isFinite(retryAfterSeconds) && retryAfterSeconds > 0;

    BackoffWindow updated =
        window.updateAndGet(
            previous -> {
              long backoffMs;
              if (hinted) {
                backoffMs = Math.round(retryAfterSeconds * 1000);
              } else {
                long previousMs = previous.remainingAt(now) > 0 ? previous.backoffMs() : 0;
                backoffMs =
                    previousMs == 0 ? INITIAL_BACKOFF_MS : Math.min(previousMs * 2, MAX_BACKOFF_MS);
              }
              return new BackoffWindow(now, backoffMs);
            });

    LOGGER.warn(
        "Rate limit hit{}. Backing off for {}s",
        hinted ? " (retry-after " + retryAfterSeconds + "s)" : "",
        String.format("%.1f", updated.backoffMs() / 1000.0));
  }

  /**
   * Block until the current window closes. Returns immediately when not limited.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void waitForBackoff() throws InterruptedException {
    long remaining = getRemainingBackoffMs();
    if (remaining > 0) {
      LOGGER.info(
          "Waiting {}s for rate limit backoff", String.format("%.1f", remaining / 1000.0));
      sleeper.sleep(Duration.ofMillis(remaining));
    }
  }

  /** Clear all backoff state. */
  public void reset() {
    window.set(BackoffWindow.NONE);
  }

  private record BackoffWindow(long lastHitAtMillis, long backoffMs) {

    static final BackoffWindow NONE = new BackoffWindow(0, 0);

    long remainingAt(long nowMillis) {
      if (backoffMs == 0) {
        return 0;
      }
      return Math.max(0, backoffMs - (nowMillis - lastHitAtMillis));
    }
  }
}
