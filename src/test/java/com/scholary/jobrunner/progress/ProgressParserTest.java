package com.scholary.jobrunner.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.jobrunner.job.JobProgress;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class ProgressParserTest {

  private final ProgressParser parser = new ProgressParser();

  @Test
  void parse_shouldReadProgressRatio() {
    assertThat(parser.parse("Progress: 5/10"))
        .contains(new JobProgress(5, 10, "Processing 5 of 10"));
  }

  @Test
  void parse_shouldReadProcessingOf() {
    assertThat(parser.parse("Processing 3 of 7"))
        .contains(new JobProgress(3, 7, "Processing 3 of 7"));
  }

  @Test
  void parse_shouldReadPagesRatio() {
    assertThat(parser.parse("Fetched 12/40 pages so far"))
        .contains(new JobProgress(12, 40, "Processing 12 of 40"));
  }

  @Test
  void parse_shouldUseAsciiDigitsWhateverTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
    try {
      assertThat(parser.parse("Progress: 5/10"))
          .contains(new JobProgress(5, 10, "Processing 5 of 10"));
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void parse_shouldIgnoreCase() {
    assertThat(parser.parse("PROGRESS: 1/2")).isPresent();
    assertThat(parser.parse("processing 1 OF 2")).isPresent();
  }

  @Test
  void parse_shouldPreferFirstPatternWhenSeveralMatch() {
    assertThat(parser.parse("Processing 1 of 9, Progress: 4/8"))
        .map(JobProgress::current)
        .contains(4L);
  }

  @Test
  void parse_shouldAcceptCurrentAboveTotal() {
    assertThat(parser.parse("Progress: 12/10")).map(JobProgress::current).contains(12L);
  }

  @Test
  void parse_shouldReturnEmptyForUnrelatedOutput() {
    assertThat(parser.parse("Fetching page abc123")).isEmpty();
    assertThat(parser.parse("")).isEmpty();
    assertThat(parser.parse(null)).isEmpty();
    assertThat(parser.parse("Progress: five/ten")).isEmpty();
  }

  @Test
  void parse_shouldIgnoreNumbersTooLargeForLong() {
    assertThat(parser.parse("Progress: 99999999999999999999/1")).isEmpty();
  }

  @Test
  void customPatterns_shouldReplaceDefaults() {
    ProgressParser custom =
        new ProgressParser(List.of(ProgressPattern.of("step", "step (\\d+) of (\\d+)")));

    assertThat(custom.parse("step 2 of 3")).map(JobProgress::total).contains(3L);
    assertThat(custom.parse("Progress: 2/3")).isEmpty();
  }

  @Test
  void constructor_shouldRejectEmptyPatternList() {
    assertThatThrownBy(() -> new ProgressParser(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
