package com.scholary.jobrunner.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RateLimitSignalDetectorTest {

  private final RateLimitSignalDetector detector = new RateLimitSignalDetector();

  @Test
  void detect_shouldRecognizeStatus429() {
    assertThat(detector.detect("APIResponseError: status 429")).isPresent();
    assertThat(detector.detect("HTTP/1.1 429 Too Many Requests")).isPresent();
  }

  @Test
  void detect_shouldRecognizeRateLimitWording() {
    assertThat(detector.detect("Notion API rate limited, slowing down")).isPresent();
    assertThat(detector.detect("error code: rate_limited")).isPresent();
    assertThat(detector.detect("RateLimitError: slow down")).isPresent();
    assertThat(detector.detect("Rate limit hit on page 3")).isPresent();
  }

  @Test
  void detect_shouldIgnorePlainRateLimitMentions() {
    assertThat(detector.detect("Using rate limit: 3 req/s")).isEmpty();
    assertThat(detector.detect("rate-limit budget configured")).isEmpty();
  }

  @Test
  void detect_shouldReadRetryAfterHint() {
    RateLimitSignal signal =
        detector.detect("429 Too Many Requests, Retry-After: 30").orElseThrow();

    assertThat(signal.hasRetryHint()).isTrue();
    assertThat(signal.retryAfterSeconds()).isEqualTo(30.0);
  }

  @Test
  void detect_shouldReadRetryAfterSecondsPhrase() {
    RateLimitSignal signal =
        detector.detect("Rate limit exceeded, retry after 2.5 seconds").orElseThrow();

    assertThat(signal.retryAfterSeconds()).isEqualTo(2.5);
  }

  @Test
  void detect_withoutHint_shouldReturnSignalWithoutRetry() {
    RateLimitSignal signal = detector.detect("Too many requests").orElseThrow();

    assertThat(signal.hasRetryHint()).isFalse();
  }

  @Test
  void detect_shouldIgnoreOrdinaryOutput() {
    assertThat(detector.detect("Processing 429 of 500")).isEmpty();
    assertThat(detector.detect("Fetched page 4290")).isEmpty();
    assertThat(detector.detect("")).isEmpty();
    assertThat(detector.detect(null)).isEmpty();
  }
}
